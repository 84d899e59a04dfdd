/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.infra.metrics.impl.inmemory;

import com.waypoint.endpoints.infra.metrics.MetricsRegistry;
import com.waypoint.endpoints.infra.metrics.api.MetricsRegistryProvider;

/**
 * Not registered by default; test class paths add it to
 * {@code META-INF/services} to outrank Prometheus.
 */
public final class InMemoryMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new InMemoryMetricsRegistry();
    }

    @Override
    public int priority() {
        return 1000;
    }

    @Override
    public String name() {
        return "InMemory";
    }
}
