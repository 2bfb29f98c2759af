package com.lrp.protocol.model;

import java.util.UUID;

/** Random 128-bit ids ({@link UUID#randomUUID()}). Stateless, shared by all sessions. */
public final class UuidIdGenerator implements IdGenerator {

    public static final UuidIdGenerator INSTANCE = new UuidIdGenerator();

    private UuidIdGenerator() {
    }

    @Override
    public String nextId() {
        return UUID.randomUUID().toString();
    }
}
