/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.infra.metrics;

/**
 * A value that can go up and down, e.g. the node count of the active model.
 */
public interface Gauge {

    void set(double value);

    double value();
}
