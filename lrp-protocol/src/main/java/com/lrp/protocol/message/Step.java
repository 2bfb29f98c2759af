package com.lrp.protocol.message;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One atomic unit of execution progress. The type names the kind of step; info carries its
 * language-specific details (usually ids of AST elements involved).
 */
@JsonPropertyOrder({"type", "info"})
public class Step {

    private final String type;
    private final Map<String, Object> info;

    public Step(String type, Map<String, Object> info) {
        this.type = Objects.requireNonNull(type, "type");
        this.info = info != null ? Collections.unmodifiableMap(new LinkedHashMap<>(info)) : Map.of();
    }

    public String getType() {
        return type;
    }

    public Map<String, Object> getInfo() {
        return info;
    }
}
