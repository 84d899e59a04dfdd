/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

public record IntegerValue(int value) implements Value {

    @Override
    public ValueType type() {
        return ValueType.INTEGER;
    }

    @Override
    public String render() {
        return Integer.toString(value);
    }

    @Override
    @JsonValue
    public int asInteger() {
        return value;
    }

    @Override
    public String toString() {
        return render();
    }
}
