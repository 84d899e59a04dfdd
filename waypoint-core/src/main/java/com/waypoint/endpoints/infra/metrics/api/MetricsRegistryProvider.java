/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.infra.metrics.api;

import com.waypoint.endpoints.infra.metrics.MetricsRegistry;

/**
 * Service provider for {@link MetricsRegistry} implementations, registered in
 * {@code META-INF/services}. The provider with the highest priority wins.
 */
public interface MetricsRegistryProvider {

    MetricsRegistry create();

    default int priority() {
        return 0;
    }

    default String name() {
        return getClass().getSimpleName();
    }
}
