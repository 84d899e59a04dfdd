/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.runtime.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.waypoint.endpoints.api.model.ArrayValue;
import com.waypoint.endpoints.api.model.Value;
import com.waypoint.endpoints.api.model.ValueType;

/**
 * Declared type of a rule-set parameter.
 */
public enum ParameterType {
    STRING("String"),
    BOOLEAN("Boolean"),
    STRING_ARRAY("StringArray");

    private final String serializedName;

    ParameterType(String serializedName) {
        this.serializedName = serializedName;
    }

    public boolean matches(Value value) {
        switch (this) {
            case STRING:
                return value.type() == ValueType.STRING;
            case BOOLEAN:
                return value.type() == ValueType.BOOLEAN;
            case STRING_ARRAY:
                return value instanceof ArrayValue array && array.isStringArray();
            default:
                return false;
        }
    }

    /**
     * Accepts the serialized names ("String", "Boolean", "StringArray") as well as
     * enum constant names, case-insensitively.
     *
     * @return the matching type, or null if unknown
     */
    public static ParameterType fromString(String text) {
        if (text == null) return null;
        for (ParameterType type : values()) {
            if (type.serializedName.equalsIgnoreCase(text) || type.name().equalsIgnoreCase(text)) {
                return type;
            }
        }
        return null;
    }

    @JsonValue
    public String getSerializedName() {
        return serializedName;
    }
}
