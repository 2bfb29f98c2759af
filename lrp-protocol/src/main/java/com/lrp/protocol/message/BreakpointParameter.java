package com.lrp.protocol.message;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Parameter of a {@link BreakpointType}. A parameter is either a primitive value
 * ({@link #getPrimitiveType()}) or a reference to an AST node of the type named by
 * {@link #getObjectType()}; exactly one of the two is expected to be set, which the model
 * does not enforce.
 */
@JsonPropertyOrder({"name", "isMultivalued", "primitiveType", "objectType"})
public final class BreakpointParameter {

    private final String name;
    private final PrimitiveType primitiveType;
    private final String objectType;
    private final boolean multivalued;

    @JsonCreator
    public BreakpointParameter(
            @JsonProperty("name") String name,
            @JsonProperty("primitiveType") PrimitiveType primitiveType,
            @JsonProperty("objectType") String objectType,
            @JsonProperty("isMultivalued") boolean multivalued) {
        this.name = Objects.requireNonNull(name, "name");
        this.primitiveType = primitiveType;
        this.objectType = objectType;
        this.multivalued = multivalued;
    }

    /** Convenience: single-valued primitive parameter. */
    public static BreakpointParameter primitive(String name, PrimitiveType primitiveType) {
        return new BreakpointParameter(name, primitiveType, null, false);
    }

    /** Convenience: single-valued parameter referring to an AST node of {@code objectType}. */
    public static BreakpointParameter object(String name, String objectType) {
        return new BreakpointParameter(name, null, objectType, false);
    }

    public String getName() {
        return name;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public PrimitiveType getPrimitiveType() {
        return primitiveType;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String getObjectType() {
        return objectType;
    }

    @JsonProperty("isMultivalued")
    public boolean isMultivalued() {
        return multivalued;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BreakpointParameter that = (BreakpointParameter) o;
        return multivalued == that.multivalued && Objects.equals(name, that.name)
                && primitiveType == that.primitiveType && Objects.equals(objectType, that.objectType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, primitiveType, objectType, multivalued);
    }
}
