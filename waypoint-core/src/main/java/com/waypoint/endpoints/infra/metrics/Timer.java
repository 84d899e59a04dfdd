/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.infra.metrics;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Latency distribution.
 */
public interface Timer {

    /**
     * Times {@code callable}. The duration is recorded even when it throws.
     */
    <T> T record(Callable<T> callable) throws Exception;

    void record(Duration duration);

    /**
     * @param percentile in [0, 1]
     * @throws UnsupportedOperationException if the backend computes percentiles server-side
     */
    Duration percentile(double percentile);
}
