package com.lrp.config;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration loaded from environment variables for the LRP backend.
 * <p>
 * Tree guards: LRP_MAX_TREE_DEPTH bounds nested-initial resolution and serialization depth.
 * Ids: LRP_ID_STRATEGY selects {@code uuid} (random 128-bit) or {@code sequential} (per-session counter).
 * Responses: LRP_VALIDATE_REFERENCES checks that every ref in a parse response resolves;
 * LRP_PRETTY_JSON indents JSON output.
 */
public final class LrpConfig {

    private static final String ENV_MAX_TREE_DEPTH = "LRP_MAX_TREE_DEPTH";
    private static final String ENV_ID_STRATEGY = "LRP_ID_STRATEGY";
    private static final String ENV_VALIDATE_REFERENCES = "LRP_VALIDATE_REFERENCES";
    private static final String ENV_PRETTY_JSON = "LRP_PRETTY_JSON";

    public static final int DEFAULT_MAX_TREE_DEPTH = 256;
    private static final IdStrategy DEFAULT_ID_STRATEGY = IdStrategy.UUID;
    private static final boolean DEFAULT_VALIDATE_REFERENCES = true;
    private static final boolean DEFAULT_PRETTY_JSON = false;

    private final int maxTreeDepth;
    private final IdStrategy idStrategy;
    private final boolean validateReferences;
    private final boolean prettyJson;

    private LrpConfig(Builder b) {
        this.maxTreeDepth = b.maxTreeDepth;
        this.idStrategy = b.idStrategy;
        this.validateReferences = b.validateReferences;
        this.prettyJson = b.prettyJson;
    }

    /** Configuration with every value at its default. */
    public static LrpConfig defaults() {
        return builder().build();
    }

    public static LrpConfig fromEnvironment() {
        return fromMap(System.getenv());
    }

    /**
     * Reads the same keys as {@link #fromEnvironment()} from the given map. Missing, blank or unparsable
     * values fall back to defaults.
     */
    public static LrpConfig fromMap(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        return builder()
                .maxTreeDepth(parseInt(env.get(ENV_MAX_TREE_DEPTH), DEFAULT_MAX_TREE_DEPTH))
                .idStrategy(IdStrategy.fromValue(env.get(ENV_ID_STRATEGY)))
                .validateReferences(parseBoolean(env.get(ENV_VALIDATE_REFERENCES), DEFAULT_VALIDATE_REFERENCES))
                .prettyJson(parseBoolean(env.get(ENV_PRETTY_JSON), DEFAULT_PRETTY_JSON))
                .build();
    }

    /** Maximum nesting depth accepted while resolving initial states or serializing a tree. Default 256. */
    public int getMaxTreeDepth() {
        return maxTreeDepth;
    }

    /** How node ids are generated for a session. Default {@link IdStrategy#UUID}. */
    public IdStrategy getIdStrategy() {
        return idStrategy;
    }

    /** Whether parse responses are checked for refs pointing outside the response. Default true. */
    public boolean isValidateReferences() {
        return validateReferences;
    }

    public boolean isPrettyJson() {
        return prettyJson;
    }

    public static Builder builder() {
        return new Builder();
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            return parsed > 0 ? parsed : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /** Node id generation strategy. */
    public enum IdStrategy {
        /** Random UUID per node. */
        UUID,
        /** Monotonically increasing counter per session. */
        SEQUENTIAL;

        /** Parses {@code uuid} / {@code sequential} (case-insensitive); anything else yields {@link #UUID}. */
        public static IdStrategy fromValue(String value) {
            if (value == null || value.isBlank()) return DEFAULT_ID_STRATEGY;
            String normalized = value.trim().toUpperCase(Locale.ROOT);
            for (IdStrategy s : values()) {
                if (s.name().equals(normalized)) return s;
            }
            return DEFAULT_ID_STRATEGY;
        }
    }

    public static final class Builder {
        private int maxTreeDepth = DEFAULT_MAX_TREE_DEPTH;
        private IdStrategy idStrategy = DEFAULT_ID_STRATEGY;
        private boolean validateReferences = DEFAULT_VALIDATE_REFERENCES;
        private boolean prettyJson = DEFAULT_PRETTY_JSON;

        public Builder maxTreeDepth(int maxTreeDepth) {
            if (maxTreeDepth <= 0) {
                throw new IllegalArgumentException("maxTreeDepth must be positive: " + maxTreeDepth);
            }
            this.maxTreeDepth = maxTreeDepth;
            return this;
        }

        public Builder idStrategy(IdStrategy idStrategy) {
            this.idStrategy = idStrategy != null ? idStrategy : DEFAULT_ID_STRATEGY;
            return this;
        }

        public Builder validateReferences(boolean validateReferences) {
            this.validateReferences = validateReferences;
            return this;
        }

        public Builder prettyJson(boolean prettyJson) {
            this.prettyJson = prettyJson;
            return this;
        }

        public LrpConfig build() {
            return new LrpConfig(this);
        }
    }
}
