package com.lrp.protocol.message;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Primitive value type of a breakpoint parameter. JSON uses the lower-case value
 * ({@code boolean}, {@code string}, {@code number}).
 */
public enum PrimitiveType {
    BOOLEAN("boolean"),
    STRING("string"),
    NUMBER("number");

    private final String value;

    PrimitiveType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Returns null for null, blank or unknown values. */
    @JsonCreator
    public static PrimitiveType fromValue(String value) {
        if (value == null || value.isBlank()) return null;
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (PrimitiveType t : values()) {
            if (t.value.equals(normalized)) return t;
        }
        return null;
    }
}
