package com.lrp.protocol.model;

import java.util.Objects;

/**
 * Any node exposed across the protocol boundary. The id is drawn once from the session's
 * {@link IdGenerator} at construction and never changes; the type is a dotted namespace string
 * naming the node's semantic kind (e.g. {@code stateMachine.state}).
 */
public abstract class ModelElement {

    private final String id;
    private final String type;

    protected ModelElement(String type, IdGenerator ids) {
        this.type = Objects.requireNonNull(type, "type");
        this.id = Objects.requireNonNull(Objects.requireNonNull(ids, "ids").nextId(), "generated id");
    }

    public final String getId() {
        return id;
    }

    public final String getType() {
        return type;
    }

    /**
     * Builds this element's record. Nested elements must be serialized through
     * {@link SerializationContext#serialize(ModelElement)} so depth is tracked.
     */
    protected abstract WireRecord toWireRecord(SerializationContext context);

    /** Serializes this element with the default depth ceiling. */
    public final WireRecord toWireRecord() {
        return SerializationContext.defaults().serialize(this);
    }

    /** Record builder pre-filled with id and type. */
    protected WireRecord.Builder recordBuilder() {
        return WireRecord.builder(id, type);
    }
}
