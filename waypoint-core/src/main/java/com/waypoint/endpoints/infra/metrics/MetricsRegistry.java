/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.infra.metrics;

import com.waypoint.endpoints.infra.metrics.internal.MetricsRegistryHolder;

/**
 * Factory for named meters.
 *
 * <p>Tags are given as alternating key/value pairs:
 * <pre>{@code
 * registry.counter("waypoint.resolutions", "outcome", "SUCCESS").increment();
 * }</pre>
 * Asking twice for the same name and tags returns the same meter.
 */
public interface MetricsRegistry {

    Counter counter(String name, String... tags);

    Gauge gauge(String name, String... tags);

    Timer timer(String name, String... tags);

    /**
     * The process-wide registry, chosen once by {@link java.util.ServiceLoader}
     * discovery of {@link com.waypoint.endpoints.infra.metrics.api.MetricsRegistryProvider}s.
     */
    static MetricsRegistry getInstance() {
        return MetricsRegistryHolder.INSTANCE;
    }
}
