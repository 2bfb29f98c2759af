package com.lrp.protocol.error;

/**
 * Thrown when nesting exceeds the configured depth ceiling during initial-state resolution or
 * serialization.
 */
public final class RecursionLimitException extends LrpModelException {

    private final int limit;

    public RecursionLimitException(String elementType, String elementId, int limit) {
        super(elementId, String.format("Nesting depth limit %d exceeded at %s element=%s", limit, elementType, elementId));
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
