/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.runtime.functions;

import com.waypoint.endpoints.api.model.Value;
import com.waypoint.endpoints.runtime.diagnostics.DiagnosticsCollector;

import java.util.Optional;

/**
 * A function callable from conditions and expressions.
 *
 * <p>Implementations must be pure with respect to their arguments and whatever
 * state they loaded at initialization, and safe to call concurrently.
 */
@FunctionalInterface
public interface EndpointFunction {

    /**
     * @param args        evaluated arguments; entries are null for absent values only
     *                    when the function was registered as accepting absent arguments
     * @param diagnostics collector for explaining why no value was produced
     * @return the result, or empty for "absent"
     */
    Optional<Value> apply(Value[] args, DiagnosticsCollector diagnostics);
}
