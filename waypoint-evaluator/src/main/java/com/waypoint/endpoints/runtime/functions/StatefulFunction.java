/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.runtime.functions;

/**
 * A function that needs data loaded before its first call (e.g. partition
 * tables). {@link FunctionRegistry#prepare} initializes only the stateful
 * functions a model actually uses.
 */
public interface StatefulFunction extends EndpointFunction {

    /**
     * Loads state. Must be idempotent.
     *
     * @throws IllegalStateException if the state cannot be loaded
     */
    void initialize();

    boolean isInitialized();
}
