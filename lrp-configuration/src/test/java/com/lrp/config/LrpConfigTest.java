package com.lrp.config;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LrpConfigTest {

    @Test
    void fromMap_emptyUsesDefaults() {
        LrpConfig config = LrpConfig.fromMap(Map.of());

        assertEquals(LrpConfig.DEFAULT_MAX_TREE_DEPTH, config.getMaxTreeDepth());
        assertEquals(LrpConfig.IdStrategy.UUID, config.getIdStrategy());
        assertTrue(config.isValidateReferences());
        assertFalse(config.isPrettyJson());
    }

    @Test
    void fromMap_readsAllKeys() {
        LrpConfig config = LrpConfig.fromMap(Map.of(
                "LRP_MAX_TREE_DEPTH", " 12 ",
                "LRP_ID_STRATEGY", "Sequential",
                "LRP_VALIDATE_REFERENCES", "false",
                "LRP_PRETTY_JSON", "1"));

        assertEquals(12, config.getMaxTreeDepth());
        assertEquals(LrpConfig.IdStrategy.SEQUENTIAL, config.getIdStrategy());
        assertFalse(config.isValidateReferences());
        assertTrue(config.isPrettyJson());
    }

    @Test
    void fromMap_invalidValuesFallBackToDefaults() {
        LrpConfig config = LrpConfig.fromMap(Map.of(
                "LRP_MAX_TREE_DEPTH", "deep",
                "LRP_ID_STRATEGY", "snowflake"));

        assertEquals(LrpConfig.DEFAULT_MAX_TREE_DEPTH, config.getMaxTreeDepth());
        assertEquals(LrpConfig.IdStrategy.UUID, config.getIdStrategy());

        assertEquals(LrpConfig.DEFAULT_MAX_TREE_DEPTH,
                LrpConfig.fromMap(Map.of("LRP_MAX_TREE_DEPTH", "-3")).getMaxTreeDepth());
    }

    @Test
    void builder_rejectsNonPositiveDepth() {
        assertThrows(IllegalArgumentException.class, () -> LrpConfig.builder().maxTreeDepth(0));
    }
}
