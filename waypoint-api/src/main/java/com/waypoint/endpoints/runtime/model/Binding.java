/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.runtime.model;

import com.waypoint.endpoints.api.model.ValueType;

import java.io.Serializable;
import java.util.Objects;

/**
 * Names the context variable a condition stores its function result under.
 */
public record Binding(String name, ValueType type) implements Serializable {

    public Binding {
        Objects.requireNonNull(name, "binding name must not be null");
        type = type == null ? ValueType.ANY : type;
    }

    public static Binding of(String name) {
        return new Binding(name, ValueType.ANY);
    }
}
