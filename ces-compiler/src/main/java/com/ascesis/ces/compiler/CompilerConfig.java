/*
 * Copyright (c) 2025 Ascesis CES Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.ces.compiler;

import com.ascesis.ces.compiler.coherence.CoherenceMode;
import com.ascesis.ces.compiler.fit.FitTransformer;

import java.util.Optional;
import java.util.logging.Logger;

/**
 * Settings of a {@link StructureCompiler}.
 *
 * <p><b>Environment override:</b> {@link #builder()} starts from the defaults
 * and applies, for each property, an environment variable or, when it is
 * unset, a system property of the same name:
 * <pre>
 * CES_ROOT_NAME=Main
 * CES_COHERENCE_MODE=strict
 * CES_MAX_FIT_ITERATIONS=10000
 * CES_CACHE_ENABLED=true
 * CES_CACHE_MAX_SIZE=256
 * </pre>
 * Explicit builder calls win over both. {@link #defaults()} ignores the environment.
 */
public final class CompilerConfig {

    private static final Logger logger = Logger.getLogger(CompilerConfig.class.getName());

    static final String ENV_ROOT_NAME = "CES_ROOT_NAME";
    static final String ENV_COHERENCE_MODE = "CES_COHERENCE_MODE";
    static final String ENV_MAX_FIT_ITERATIONS = "CES_MAX_FIT_ITERATIONS";
    static final String ENV_CACHE_ENABLED = "CES_CACHE_ENABLED";
    static final String ENV_CACHE_MAX_SIZE = "CES_CACHE_MAX_SIZE";

    public static final String DEFAULT_ROOT_NAME = "Main";

    private final String rootName;
    private final CoherenceMode coherenceMode;
    private final int maxFitIterations;
    private final boolean cacheEnabled;
    private final long cacheMaxSize;

    private CompilerConfig(Builder builder) {
        this.rootName = builder.rootName;
        this.coherenceMode = builder.coherenceMode;
        this.maxFitIterations = builder.maxFitIterations;
        this.cacheEnabled = builder.cacheEnabled;
        this.cacheMaxSize = builder.cacheMaxSize;
        validate();
    }

    public static Builder builder() {
        return new Builder(true);
    }

    public static CompilerConfig defaults() {
        return new Builder(false).build();
    }

    public static CompilerConfig fromEnvironment() {
        return builder().build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder(false);
        builder.rootName = rootName;
        builder.coherenceMode = coherenceMode;
        builder.maxFitIterations = maxFitIterations;
        builder.cacheEnabled = cacheEnabled;
        builder.cacheMaxSize = cacheMaxSize;
        return builder;
    }

    private void validate() {
        if (rootName == null || rootName.isBlank()) {
            throw new IllegalArgumentException("rootName must not be blank");
        }
        if (coherenceMode == null) {
            throw new IllegalArgumentException("coherenceMode must not be null");
        }
        if (maxFitIterations <= 0) {
            throw new IllegalArgumentException("maxFitIterations must be positive: " + maxFitIterations);
        }
        if (cacheMaxSize <= 0) {
            throw new IllegalArgumentException("cacheMaxSize must be positive: " + cacheMaxSize);
        }
    }

    public String getRootName() {
        return rootName;
    }

    public CoherenceMode getCoherenceMode() {
        return coherenceMode;
    }

    public int getMaxFitIterations() {
        return maxFitIterations;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public long getCacheMaxSize() {
        return cacheMaxSize;
    }

    @Override
    public String toString() {
        return "CompilerConfig{root=" + rootName + ", coherence=" + coherenceMode
                + ", maxFitIterations=" + maxFitIterations + ", cache=" + (cacheEnabled ? cacheMaxSize : "off") + "}";
    }

    public static final class Builder {

        private String rootName = DEFAULT_ROOT_NAME;
        private CoherenceMode coherenceMode = CoherenceMode.LENIENT;
        private int maxFitIterations = FitTransformer.DEFAULT_MAX_ITERATIONS;
        private boolean cacheEnabled = true;
        private long cacheMaxSize = 256;

        private Builder(boolean applyEnvironment) {
            if (applyEnvironment) {
                applyEnvironmentVariables();
            }
        }

        private void applyEnvironmentVariables() {
            getEnvOrProperty(ENV_ROOT_NAME).ifPresent(val -> this.rootName = val);
            getEnvOrProperty(ENV_COHERENCE_MODE).ifPresent(val -> {
                try {
                    this.coherenceMode = CoherenceMode.fromString(val);
                } catch (IllegalArgumentException e) {
                    logger.warning("Invalid " + ENV_COHERENCE_MODE + ": " + val + ", using default: " + coherenceMode);
                }
            });
            getEnvInt(ENV_MAX_FIT_ITERATIONS).ifPresent(val -> this.maxFitIterations = val);
            getEnvOrProperty(ENV_CACHE_ENABLED).ifPresent(val -> this.cacheEnabled = parseBoolean(val));
            getEnvLong(ENV_CACHE_MAX_SIZE).ifPresent(val -> this.cacheMaxSize = val);
        }

        public Builder rootName(String rootName) {
            this.rootName = rootName;
            return this;
        }

        public Builder coherenceMode(CoherenceMode coherenceMode) {
            this.coherenceMode = coherenceMode;
            return this;
        }

        public Builder maxFitIterations(int maxFitIterations) {
            this.maxFitIterations = maxFitIterations;
            return this;
        }

        public Builder cacheEnabled(boolean cacheEnabled) {
            this.cacheEnabled = cacheEnabled;
            return this;
        }

        public Builder cacheMaxSize(long cacheMaxSize) {
            this.cacheMaxSize = cacheMaxSize;
            return this;
        }

        public CompilerConfig build() {
            return new CompilerConfig(this);
        }

        /**
         * Environment variable first, then system property.
         */
        private static Optional<String> getEnvOrProperty(String key) {
            String value = System.getenv(key);
            if (value == null || value.trim().isEmpty()) {
                value = System.getProperty(key);
            }
            if (value != null && !value.trim().isEmpty()) {
                logger.fine("Loaded setting: " + key + "=" + value.trim());
                return Optional.of(value.trim());
            }
            return Optional.empty();
        }

        private static Optional<Integer> getEnvInt(String key) {
            return getEnvOrProperty(key).map(val -> {
                try {
                    return Integer.parseInt(val);
                } catch (NumberFormatException e) {
                    logger.warning("Invalid int value for " + key + ": " + val);
                    return null;
                }
            });
        }

        private static Optional<Long> getEnvLong(String key) {
            return getEnvOrProperty(key).map(val -> {
                try {
                    return Long.parseLong(val);
                } catch (NumberFormatException e) {
                    logger.warning("Invalid long value for " + key + ": " + val);
                    return null;
                }
            });
        }

        private static boolean parseBoolean(String val) {
            String normalized = val.toLowerCase();
            return "true".equals(normalized) || "1".equals(normalized) || "yes".equals(normalized);
        }
    }
}
