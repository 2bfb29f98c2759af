package com.lrp.protocol.message;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Breakpoint kind a language backend declares to the front-end, with the parameters a user
 * fills in when setting it.
 */
@JsonPropertyOrder({"id", "name", "description", "parameters"})
public final class BreakpointType {

    private final String id;
    private final String name;
    private final List<BreakpointParameter> parameters;
    private final String description;

    @JsonCreator
    public BreakpointType(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("parameters") List<BreakpointParameter> parameters,
            @JsonProperty("description") String description) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.parameters = parameters != null ? List.copyOf(parameters) : List.of();
        this.description = description != null ? description : "";
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    /** Human-readable description; empty string when none was declared. */
    public String getDescription() {
        return description;
    }

    public List<BreakpointParameter> getParameters() {
        return parameters;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BreakpointType that = (BreakpointType) o;
        return Objects.equals(id, that.id) && Objects.equals(name, that.name)
                && Objects.equals(parameters, that.parameters) && Objects.equals(description, that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, parameters, description);
    }
}
