package com.lrp.protocol.model;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-session counter ids ({@code n1}, {@code n2}, ...). Deterministic, which makes responses
 * comparable across runs of the same session.
 */
public final class SequentialIdGenerator implements IdGenerator {

    private static final String DEFAULT_PREFIX = "n";

    private final String prefix;
    private final AtomicLong counter = new AtomicLong();

    public SequentialIdGenerator() {
        this(DEFAULT_PREFIX);
    }

    public SequentialIdGenerator(String prefix) {
        this.prefix = prefix != null ? prefix : DEFAULT_PREFIX;
    }

    @Override
    public String nextId() {
        return prefix + counter.incrementAndGet();
    }
}
