package com.lrp.protocol.error;

/**
 * Thrown when a tree is not well-formed, e.g. a composite state has no initial state at
 * resolution or serialization time.
 */
public final class MalformedTreeException extends LrpModelException {

    public MalformedTreeException(String elementId, String message) {
        super(elementId, elementId != null ? message + " (element=" + elementId + ")" : message);
    }
}
