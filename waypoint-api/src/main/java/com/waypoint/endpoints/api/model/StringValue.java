/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

public record StringValue(String value) implements Value {

    public StringValue {
        Objects.requireNonNull(value, "value must not be null");
    }

    @Override
    public ValueType type() {
        return ValueType.STRING;
    }

    @Override
    public String render() {
        return value;
    }

    @Override
    @JsonValue
    public String asString() {
        return value;
    }

    @Override
    public String toString() {
        return '"' + value + '"';
    }
}
