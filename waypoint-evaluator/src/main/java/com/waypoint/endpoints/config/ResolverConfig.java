/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;
import java.util.function.Function;

/**
 * Configuration for endpoint resolvers and the services around them.
 *
 * <p><b>Environment Variable Override:</b>
 * Every property can be overridden via environment variables using the pattern
 * {@code WAYPOINT_<PROPERTY_NAME>}:
 * <pre>
 * WAYPOINT_MAX_TRAVERSAL_STEPS=5000
 * WAYPOINT_TRACE_ON_SUCCESS=true
 * WAYPOINT_PARTITIONS_PATH=/etc/waypoint/partitions.json
 * WAYPOINT_PARTITION_CACHE_SIZE=2048
 * WAYPOINT_RELOAD_INTERVAL_SECONDS=30
 * </pre>
 *
 * <p>Precedence, lowest to highest: builder defaults, {@code waypoint.properties},
 * environment variables, explicit builder calls.
 *
 * <pre>{@code
 * ResolverConfig config = ResolverConfig.loadDefault()
 *     .toBuilder()
 *     .traceOnSuccess(true)
 *     .build();
 * }</pre>
 */
public final class ResolverConfig {
    private static final Logger logger = LoggerFactory.getLogger(ResolverConfig.class);

    // ========================================================================
    // ENVIRONMENT VARIABLE KEYS
    // ========================================================================

    static final String ENV_MAX_TRAVERSAL_STEPS = "WAYPOINT_MAX_TRAVERSAL_STEPS";
    static final String ENV_TRACE_ON_SUCCESS = "WAYPOINT_TRACE_ON_SUCCESS";
    static final String ENV_PARTITIONS_PATH = "WAYPOINT_PARTITIONS_PATH";
    static final String ENV_PARTITION_CACHE_SIZE = "WAYPOINT_PARTITION_CACHE_SIZE";
    static final String ENV_RELOAD_INTERVAL_SECONDS = "WAYPOINT_RELOAD_INTERVAL_SECONDS";

    public static final String DEFAULT_PROPERTIES_FILE = "waypoint.properties";

    // ========================================================================
    // CONFIGURATION FIELDS
    // ========================================================================

    private final int maxTraversalSteps;
    private final boolean traceOnSuccess;
    private final String partitionsPath;
    private final long partitionCacheSize;
    private final long reloadIntervalSeconds;

    private ResolverConfig(Builder builder) {
        this.maxTraversalSteps = builder.maxTraversalSteps;
        this.traceOnSuccess = builder.traceOnSuccess;
        this.partitionsPath = builder.partitionsPath;
        this.partitionCacheSize = builder.partitionCacheSize;
        this.reloadIntervalSeconds = builder.reloadIntervalSeconds;
        validate();
    }

    private void validate() {
        if (maxTraversalSteps < 0) {
            throw new IllegalArgumentException("maxTraversalSteps must be >= 0 (0 = node count + 1), got " + maxTraversalSteps);
        }
        if (partitionCacheSize <= 0) {
            throw new IllegalArgumentException("partitionCacheSize must be positive, got " + partitionCacheSize);
        }
        if (reloadIntervalSeconds <= 0) {
            throw new IllegalArgumentException("reloadIntervalSeconds must be positive, got " + reloadIntervalSeconds);
        }
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    /**
     * Defaults with no file or environment lookups. Intended for tests.
     */
    public static ResolverConfig defaults() {
        return new Builder().build();
    }

    /**
     * Loads {@value #DEFAULT_PROPERTIES_FILE} from the classpath if present, then
     * applies environment overrides.
     */
    public static ResolverConfig loadDefault() {
        return loadFromProperties(DEFAULT_PROPERTIES_FILE);
    }

    /**
     * Loads configuration from a properties file, searched on the classpath first
     * and then on the file system. A missing file leaves defaults in place.
     */
    public static ResolverConfig loadFromProperties(String propertiesPath) {
        Properties props = new Properties();

        try (InputStream is = ResolverConfig.class.getClassLoader().getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded {} resolver properties from classpath: {}", props.size(), propertiesPath);
            }
        } catch (IOException e) {
            logger.warn("Could not read classpath resource {}: {}", propertiesPath, e.getMessage());
        }

        if (props.isEmpty()) {
            try (InputStream fis = new FileInputStream(propertiesPath)) {
                props.load(fis);
                logger.info("Loaded {} resolver properties from file: {}", props.size(), propertiesPath);
            } catch (IOException e) {
                logger.debug("No resolver properties at {}, using defaults", propertiesPath);
            }
        }

        Builder builder = new Builder();
        builder.apply(props::getProperty, "waypoint.max.traversal.steps", "waypoint.trace.on.success",
                "waypoint.partitions.path", "waypoint.partition.cache.size", "waypoint.reload.interval.seconds");
        builder.loadFromEnvironment(System::getenv);
        return builder.build();
    }

    /**
     * Applies {@code WAYPOINT_*} overrides from the given environment over defaults.
     */
    public static ResolverConfig fromEnvironment(Map<String, String> environment) {
        Builder builder = new Builder();
        builder.loadFromEnvironment(environment::get);
        return builder.build();
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    /**
     * @return step budget for one walk; 0 means node count + 1
     */
    public int getMaxTraversalSteps() {
        return maxTraversalSteps;
    }

    public boolean isTraceOnSuccess() {
        return traceOnSuccess;
    }

    /**
     * @return file system path of the partition table, or null for the bundled one
     */
    public String getPartitionsPath() {
        return partitionsPath;
    }

    public long getPartitionCacheSize() {
        return partitionCacheSize;
    }

    public long getReloadIntervalSeconds() {
        return reloadIntervalSeconds;
    }

    public int effectiveStepBudget(int nodeCount) {
        return maxTraversalSteps > 0 ? maxTraversalSteps : nodeCount + 1;
    }

    @Override
    public String toString() {
        return "ResolverConfig{maxTraversalSteps=" + maxTraversalSteps
                + ", traceOnSuccess=" + traceOnSuccess
                + ", partitionsPath=" + (partitionsPath == null ? "<bundled>" : partitionsPath)
                + ", partitionCacheSize=" + partitionCacheSize
                + ", reloadIntervalSeconds=" + reloadIntervalSeconds + '}';
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    /**
     * A builder whose defaults already include environment overrides.
     */
    public static Builder builder() {
        Builder builder = new Builder();
        builder.loadFromEnvironment(System::getenv);
        return builder;
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.maxTraversalSteps = maxTraversalSteps;
        builder.traceOnSuccess = traceOnSuccess;
        builder.partitionsPath = partitionsPath;
        builder.partitionCacheSize = partitionCacheSize;
        builder.reloadIntervalSeconds = reloadIntervalSeconds;
        return builder;
    }

    public static final class Builder {
        private int maxTraversalSteps = 0;
        private boolean traceOnSuccess = false;
        private String partitionsPath = null;
        private long partitionCacheSize = 1_024;
        private long reloadIntervalSeconds = 10;

        private Builder() {
        }

        private void loadFromEnvironment(Function<String, String> env) {
            apply(env, ENV_MAX_TRAVERSAL_STEPS, ENV_TRACE_ON_SUCCESS, ENV_PARTITIONS_PATH,
                    ENV_PARTITION_CACHE_SIZE, ENV_RELOAD_INTERVAL_SECONDS);
        }

        private void apply(Function<String, String> source, String stepsKey, String traceKey,
                           String partitionsKey, String cacheKey, String reloadKey) {
            String steps = source.apply(stepsKey);
            if (steps != null) {
                maxTraversalSteps = parseInt(stepsKey, steps, maxTraversalSteps);
            }
            String trace = source.apply(traceKey);
            if (trace != null) {
                traceOnSuccess = Boolean.parseBoolean(trace.trim());
            }
            String partitions = source.apply(partitionsKey);
            if (partitions != null && !partitions.isBlank()) {
                partitionsPath = partitions.trim();
            }
            String cache = source.apply(cacheKey);
            if (cache != null) {
                partitionCacheSize = parseInt(cacheKey, cache, (int) partitionCacheSize);
            }
            String reload = source.apply(reloadKey);
            if (reload != null) {
                reloadIntervalSeconds = parseInt(reloadKey, reload, (int) reloadIntervalSeconds);
            }
        }

        private static int parseInt(String key, String raw, int fallback) {
            try {
                return Integer.parseInt(raw.trim());
            } catch (NumberFormatException e) {
                logger.warn("Ignoring invalid value for {}: '{}'", key, raw);
                return fallback;
            }
        }

        public Builder maxTraversalSteps(int maxTraversalSteps) {
            this.maxTraversalSteps = maxTraversalSteps;
            return this;
        }

        public Builder traceOnSuccess(boolean traceOnSuccess) {
            this.traceOnSuccess = traceOnSuccess;
            return this;
        }

        public Builder partitionsPath(String partitionsPath) {
            this.partitionsPath = partitionsPath;
            return this;
        }

        public Builder partitionCacheSize(long partitionCacheSize) {
            this.partitionCacheSize = partitionCacheSize;
            return this;
        }

        public Builder reloadIntervalSeconds(long reloadIntervalSeconds) {
            this.reloadIntervalSeconds = reloadIntervalSeconds;
            return this;
        }

        public ResolverConfig build() {
            return new ResolverConfig(this);
        }
    }
}
