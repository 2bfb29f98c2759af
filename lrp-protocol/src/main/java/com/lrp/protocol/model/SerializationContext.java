package com.lrp.protocol.model;

import com.lrp.config.LrpConfig;
import com.lrp.protocol.error.RecursionLimitException;

import java.util.ArrayList;
import java.util.List;

/**
 * Carries the depth ceiling through one serialization call. Not thread-safe; create one per call.
 */
public final class SerializationContext {

    private final int maxDepth;
    private int depth;

    public SerializationContext(int maxDepth) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public static SerializationContext defaults() {
        return new SerializationContext(LrpConfig.DEFAULT_MAX_TREE_DEPTH);
    }

    public static SerializationContext fromConfig(LrpConfig config) {
        return new SerializationContext(config.getMaxTreeDepth());
    }

    /**
     * Serializes the element one level below the current depth.
     *
     * @throws RecursionLimitException when the element would sit deeper than the ceiling
     */
    public WireRecord serialize(ModelElement element) {
        if (depth >= maxDepth) {
            throw new RecursionLimitException(element.getType(), element.getId(), maxDepth);
        }
        depth++;
        try {
            return element.toWireRecord(this);
        } finally {
            depth--;
        }
    }

    public List<WireRecord> serializeAll(List<? extends ModelElement> elements) {
        List<WireRecord> records = new ArrayList<>(elements.size());
        for (ModelElement element : elements) {
            records.add(serialize(element));
        }
        return records;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /** Nesting level of the element currently being serialized (1 for the root). */
    public int getDepth() {
        return depth;
    }
}
