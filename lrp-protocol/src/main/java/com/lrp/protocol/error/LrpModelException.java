package com.lrp.protocol.error;

/**
 * Base of the consistency failures raised while resolving or serializing a model tree.
 * These are defects in the tree producer: they propagate to the caller and no partial
 * response is emitted.
 */
public abstract class LrpModelException extends RuntimeException {

    private final String elementId;

    protected LrpModelException(String elementId, String message) {
        super(message);
        this.elementId = elementId;
    }

    /** Id of the element where the failure was detected (may be null). */
    public String getElementId() {
        return elementId;
    }
}
