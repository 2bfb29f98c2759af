package com.lrp.protocol.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical record exchanged across the protocol boundary for any {@link ModelElement}:
 * {@code id}, {@code type}, {@code attributes} (scalars and scalar lists), {@code children}
 * (owned nested records, either one record or a list per role), {@code refs} (ids of nodes
 * present elsewhere in the same response) and, for located AST nodes only, {@code location}.
 * <p>
 * Attribute values may be null; the key is still written. Instances are immutable.
 */
@JsonPropertyOrder({"id", "type", "attributes", "children", "refs", "location"})
public final class WireRecord {

    private final String id;
    private final String type;
    private final Map<String, Object> attributes;
    private final Map<String, Object> children;
    private final Map<String, String> refs;
    private final Location location;

    private WireRecord(Builder b) {
        this.id = b.id;
        this.type = b.type;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(b.attributes));
        this.children = Collections.unmodifiableMap(new LinkedHashMap<>(b.children));
        this.refs = Collections.unmodifiableMap(new LinkedHashMap<>(b.refs));
        this.location = b.location;
    }

    public static Builder builder(String id, String type) {
        return new Builder(id, type);
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    /** Role name to {@link WireRecord} or {@code List<WireRecord>}. */
    public Map<String, Object> getChildren() {
        return children;
    }

    public Map<String, String> getRefs() {
        return refs;
    }

    /** Present only for AST nodes that carry a source span. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public Location getLocation() {
        return location;
    }

    /** Records held under the given child role; empty when the role is absent. */
    @SuppressWarnings("unchecked")
    public List<WireRecord> childList(String role) {
        Object value = children.get(role);
        if (value == null) return List.of();
        if (value instanceof WireRecord single) return List.of(single);
        return (List<WireRecord>) value;
    }

    /** Every directly owned record, in role then list order. */
    @JsonIgnore
    public List<WireRecord> getDirectChildren() {
        List<WireRecord> all = new ArrayList<>();
        for (String role : children.keySet()) {
            all.addAll(childList(role));
        }
        return all;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WireRecord that = (WireRecord) o;
        return Objects.equals(id, that.id) && Objects.equals(type, that.type)
                && Objects.equals(attributes, that.attributes)
                && Objects.equals(children, that.children)
                && Objects.equals(refs, that.refs)
                && Objects.equals(location, that.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, attributes, children, refs, location);
    }

    @Override
    public String toString() {
        return "WireRecord{id=" + id + ", type=" + type + "}";
    }

    public static final class Builder {
        private final String id;
        private final String type;
        private final Map<String, Object> attributes = new LinkedHashMap<>();
        private final Map<String, Object> children = new LinkedHashMap<>();
        private final Map<String, String> refs = new LinkedHashMap<>();
        private Location location;

        private Builder(String id, String type) {
            this.id = Objects.requireNonNull(id, "id");
            this.type = Objects.requireNonNull(type, "type");
        }

        public Builder attribute(String name, Object value) {
            attributes.put(Objects.requireNonNull(name, "name"), value);
            return this;
        }

        public Builder child(String role, WireRecord child) {
            children.put(Objects.requireNonNull(role, "role"), Objects.requireNonNull(child, "child"));
            return this;
        }

        public Builder children(String role, List<WireRecord> records) {
            children.put(Objects.requireNonNull(role, "role"), List.copyOf(records));
            return this;
        }

        public Builder ref(String role, String targetId) {
            refs.put(Objects.requireNonNull(role, "role"), Objects.requireNonNull(targetId, "targetId"));
            return this;
        }

        public Builder location(Location location) {
            this.location = location;
            return this;
        }

        public WireRecord build() {
            return new WireRecord(this);
        }
    }
}
