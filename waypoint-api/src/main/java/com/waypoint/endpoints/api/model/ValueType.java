/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Runtime type tags for {@link Value}.
 */
public enum ValueType {
    STRING, BOOLEAN, INTEGER, ARRAY, RECORD,

    /**
     * Wildcard used by bindings whose producing function has no fixed return type.
     */
    ANY;

    /**
     * @return true if a value of {@code actual} type may be stored under this declared type
     */
    public boolean accepts(ValueType actual) {
        return this == ANY || this == actual;
    }

    /**
     * Case-insensitive lookup used by model ingestion ("String", "boolean", ...).
     *
     * @return the matching type, or null if unknown
     */
    public static ValueType fromString(String text) {
        if (text == null) return null;
        try {
            return ValueType.valueOf(text.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    @JsonValue
    public String getValue() {
        return name();
    }
}
