package com.lrp.protocol.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lrp.config.LrpConfig;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * JSON codec for protocol messages: outbound responses and wire records, inbound argument records.
 * Key names and nulls are written exactly as the message classes expose them.
 */
public final class LrpJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private LrpJson() {
    }

    /**
     * Serializes a response, wire record or argument record to compact JSON.
     *
     * @throws UncheckedIOException on serialization failure
     */
    public static String toJson(Object message) {
        return toJson(message, false);
    }

    /** Serializes a message, indented when {@link LrpConfig#isPrettyJson()} is set. */
    public static String toJson(Object message, LrpConfig config) {
        return toJson(message, config.isPrettyJson());
    }

    public static String toJson(Object message, boolean pretty) {
        try {
            return pretty
                    ? MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(message)
                    : MAPPER.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /**
     * Reads an inbound argument record (e.g. {@link com.lrp.protocol.message.CheckBreakpointArgs}).
     *
     * @throws UncheckedIOException on parse failure
     */
    public static <T> T fromJson(String json, Class<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Converts a message to a JSON tree, e.g. to inspect keys of an outgoing response. */
    public static JsonNode toTree(Object message) {
        return MAPPER.valueToTree(message);
    }
}
