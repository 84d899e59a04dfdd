/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Ordered list of values. Parameters of type {@code StringArray} are arrays whose
 * elements are all strings.
 */
public record ArrayValue(@JsonValue List<Value> elements) implements Value {

    public ArrayValue {
        elements = List.copyOf(elements);
    }

    @Override
    public ValueType type() {
        return ValueType.ARRAY;
    }

    /**
     * @return the element at {@code index}, or null when out of bounds
     */
    public Value get(int index) {
        return index >= 0 && index < elements.size() ? elements.get(index) : null;
    }

    public int size() {
        return elements.size();
    }

    public boolean isStringArray() {
        for (Value element : elements) {
            if (element.type() != ValueType.STRING) {
                return false;
            }
        }
        return true;
    }

    public List<String> asStrings() {
        List<String> out = new ArrayList<>(elements.size());
        for (Value element : elements) {
            out.add(element.asString());
        }
        return out;
    }

    @Override
    public String render() {
        StringJoiner joiner = new StringJoiner(",", "[", "]");
        for (Value element : elements) {
            joiner.add(element.render());
        }
        return joiner.toString();
    }

    @Override
    public String toString() {
        return elements.toString();
    }
}
