/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.infra.metrics.impl.inmemory;

import com.waypoint.endpoints.infra.metrics.Gauge;

final class InMemoryGauge implements Gauge {

    private final String name;
    private volatile double value;

    InMemoryGauge(String name) {
        this.name = name;
    }

    @Override
    public void set(double value) {
        this.value = value;
    }

    @Override
    public double value() {
        return value;
    }

    @Override
    public String toString() {
        return String.format("InMemoryGauge{name='%s', value=%.2f}", name, value);
    }
}
