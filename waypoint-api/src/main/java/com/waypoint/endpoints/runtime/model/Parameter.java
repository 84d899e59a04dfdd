/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.runtime.model;

import com.waypoint.endpoints.api.model.Value;

import java.io.Serializable;
import java.util.Objects;

/**
 * A rule-set parameter declaration. Values are supplied fresh on every call.
 *
 * @param defaultValue value used when the caller supplies none, or null
 * @param builtIn      identifier of the client setting that feeds this parameter
 *                     (e.g. {@code AWS::Region}), or null
 * @param deprecated   deprecation message, or null
 */
public record Parameter(
        String name,
        ParameterType type,
        boolean required,
        Value defaultValue,
        String builtIn,
        String documentation,
        String deprecated
) implements Serializable {

    public Parameter {
        Objects.requireNonNull(name, "Parameter name cannot be null");
        Objects.requireNonNull(type, "Parameter type cannot be null for " + name);
    }

    public static Parameter optional(String name, ParameterType type) {
        return new Parameter(name, type, false, null, null, null, null);
    }

    public static Parameter required(String name, ParameterType type) {
        return new Parameter(name, type, true, null, null, null, null);
    }

    public Parameter withDefault(Value value) {
        return new Parameter(name, type, required, value, builtIn, documentation, deprecated);
    }

    public Parameter withBuiltIn(String builtInName) {
        return new Parameter(name, type, required, defaultValue, builtInName, documentation, deprecated);
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
