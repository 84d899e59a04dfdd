/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

public record BooleanValue(boolean value) implements Value {

    public static final BooleanValue TRUE = new BooleanValue(true);
    public static final BooleanValue FALSE = new BooleanValue(false);

    public static BooleanValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public ValueType type() {
        return ValueType.BOOLEAN;
    }

    @Override
    public String render() {
        return Boolean.toString(value);
    }

    @Override
    @JsonValue
    public boolean asBoolean() {
        return value;
    }

    @Override
    public String toString() {
        return render();
    }
}
