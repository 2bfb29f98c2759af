package com.lrp.protocol.error;

/**
 * Thrown when a {@code refs} entry points at an id that is absent from the response it belongs to.
 */
public final class UnresolvedReferenceException extends LrpModelException {

    private final String role;
    private final String targetId;

    public UnresolvedReferenceException(String elementId, String role, String targetId) {
        super(elementId, String.format("Unresolved reference: element=%s ref=%s target=%s", elementId, role, targetId));
        this.role = role;
        this.targetId = targetId;
    }

    public String getRole() {
        return role;
    }

    public String getTargetId() {
        return targetId;
    }
}
