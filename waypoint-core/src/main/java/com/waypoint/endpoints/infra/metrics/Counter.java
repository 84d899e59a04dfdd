/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.infra.metrics;

/**
 * Monotonically increasing count, e.g. resolutions per outcome.
 */
public interface Counter {

    void increment();

    /**
     * @param amount a non-negative increment
     */
    void increment(long amount);

    long count();
}
