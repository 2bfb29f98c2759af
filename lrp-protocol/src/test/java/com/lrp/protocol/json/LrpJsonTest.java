package com.lrp.protocol.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.lrp.config.LrpConfig;
import com.lrp.protocol.message.CheckBreakpointArgs;
import com.lrp.protocol.message.StepResponse;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LrpJsonTest {

    @Test
    void toJson_compactByDefault() {
        assertEquals("{\"isExecutionDone\":true}", LrpJson.toJson(new StepResponse(true), LrpConfig.defaults()));
    }

    @Test
    void toJson_indentsWhenPrettyJsonConfigured() {
        LrpConfig config = LrpConfig.fromMap(Map.of("LRP_PRETTY_JSON", "true"));

        String json = LrpJson.toJson(new StepResponse(true), config);

        assertTrue(json.contains("\n"));
        assertTrue(json.contains("  \"isExecutionDone\" : true"));
        assertEquals(LrpJson.toTree(new StepResponse(true)), LrpJson.fromJson(json, JsonNode.class));
    }

    @Test
    void fromJson_ignoresUnknownKeysAndRejectsMalformedInput() {
        CheckBreakpointArgs args = LrpJson.fromJson(
                "{\"sourceFile\":\"a.sm\",\"typeId\":\"t\",\"elementId\":\"n2\",\"extra\":1}", CheckBreakpointArgs.class);

        assertEquals("n2", args.getElementId());
        assertFalse(args.getSourceFile().isEmpty());
        assertThrows(UncheckedIOException.class, () -> LrpJson.fromJson("{not json", CheckBreakpointArgs.class));
    }
}
