/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.api.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A typed value flowing through endpoint resolution: parameter values, function
 * results, bound variables and rendered endpoint properties.
 *
 * <p>Every implementation has value-based equality that does not depend on the
 * engine, so two structurally equal partitions or ARNs compare equal regardless
 * of which function produced them.
 *
 * <p>There is no "absent" value. Absence is expressed by the lack of a value:
 * a {@code null} slot inside the engine and {@link java.util.Optional#empty()}
 * at function boundaries.
 */
public interface Value extends Serializable {

    ValueType type();

    /**
     * String form used by templates and diagnostics.
     */
    String render();

    /**
     * @return the string payload
     * @throws IllegalStateException if this is not a string
     */
    default String asString() {
        throw new IllegalStateException("Expected STRING but was " + type());
    }

    /**
     * @return the boolean payload
     * @throws IllegalStateException if this is not a boolean
     */
    default boolean asBoolean() {
        throw new IllegalStateException("Expected BOOLEAN but was " + type());
    }

    /**
     * @return the integer payload
     * @throws IllegalStateException if this is not an integer
     */
    default int asInteger() {
        throw new IllegalStateException("Expected INTEGER but was " + type());
    }

    static StringValue of(String value) {
        return new StringValue(value);
    }

    static BooleanValue of(boolean value) {
        return BooleanValue.of(value);
    }

    static IntegerValue of(int value) {
        return new IntegerValue(value);
    }

    static ArrayValue ofStrings(List<String> values) {
        List<Value> elements = new ArrayList<>(values.size());
        for (String v : values) {
            elements.add(new StringValue(v));
        }
        return new ArrayValue(elements);
    }

    /**
     * Converts a plain Java object (as produced by JSON parsing or supplied by
     * callers) into a value.
     *
     * @param raw a String, Boolean, Number, List, Map or Value
     * @return the converted value, or null if {@code raw} is null
     * @throws IllegalArgumentException for unsupported types or non-integral numbers
     */
    static Value fromObject(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Value v) {
            return v;
        }
        if (raw instanceof String s) {
            return new StringValue(s);
        }
        if (raw instanceof Boolean b) {
            return BooleanValue.of(b);
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short) {
            long l = ((Number) raw).longValue();
            if (l < Integer.MIN_VALUE || l > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("Integer out of range: " + l);
            }
            return new IntegerValue((int) l);
        }
        if (raw instanceof List<?> list) {
            List<Value> elements = new ArrayList<>(list.size());
            for (Object element : list) {
                Value converted = fromObject(element);
                if (converted == null) {
                    throw new IllegalArgumentException("Arrays cannot contain null elements");
                }
                elements.add(converted);
            }
            return new ArrayValue(elements);
        }
        if (raw instanceof Map<?, ?> map) {
            Map<String, Value> members = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                Value converted = fromObject(entry.getValue());
                if (converted != null) {
                    members.put(String.valueOf(entry.getKey()), converted);
                }
            }
            return new RecordValue(members);
        }
        throw new IllegalArgumentException("Unsupported value type: " + raw.getClass().getName());
    }
}
