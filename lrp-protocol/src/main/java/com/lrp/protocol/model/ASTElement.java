package com.lrp.protocol.model;

/**
 * Model element that originates from source text. The location is optional: synthesized
 * nodes carry none and their records omit the {@code location} key.
 */
public abstract class ASTElement extends ModelElement {

    private final Location location;

    protected ASTElement(String type, Location location, IdGenerator ids) {
        super(type, ids);
        this.location = location;
    }

    /** Source span, or null for synthesized nodes. */
    public Location getLocation() {
        return location;
    }

    @Override
    protected WireRecord.Builder recordBuilder() {
        return super.recordBuilder().location(location);
    }
}
