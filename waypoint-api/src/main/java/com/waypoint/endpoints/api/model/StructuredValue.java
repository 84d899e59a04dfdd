/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.api.model;

import java.util.Map;

/**
 * A value exposing named attributes, navigated by the {@code getAttr} function.
 * Partition descriptors, parsed ARNs, parsed URLs and record literals are all
 * structured values.
 */
public interface StructuredValue extends Value {

    /**
     * @return the attribute value, or null if this value has no such attribute
     */
    default Value attribute(String name) {
        return attributes().get(name);
    }

    /**
     * @return attributes in declaration order
     */
    Map<String, Value> attributes();

    @Override
    default ValueType type() {
        return ValueType.RECORD;
    }

    @Override
    default String render() {
        return attributes().toString();
    }
}
