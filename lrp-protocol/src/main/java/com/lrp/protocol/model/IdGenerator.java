package com.lrp.protocol.model;

import com.lrp.config.LrpConfig;

/**
 * Source of node ids for one debug session. Ids only need to be unique within the session
 * that owns the generator.
 */
@FunctionalInterface
public interface IdGenerator {

    String nextId();

    /** Generator for the configured strategy; a sequential generator is always a fresh counter. */
    static IdGenerator forStrategy(LrpConfig.IdStrategy strategy) {
        return switch (strategy != null ? strategy : LrpConfig.IdStrategy.UUID) {
            case UUID -> UuidIdGenerator.INSTANCE;
            case SEQUENTIAL -> new SequentialIdGenerator();
        };
    }
}
