/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Generic string-keyed record, produced by record literals in endpoint properties
 * (for example an {@code authSchemes} entry).
 */
public record RecordValue(Map<String, Value> members) implements StructuredValue {

    public RecordValue {
        members = Collections.unmodifiableMap(new LinkedHashMap<>(members));
    }

    @Override
    @JsonValue
    public Map<String, Value> attributes() {
        return members;
    }

    @Override
    public String toString() {
        return members.toString();
    }
}
