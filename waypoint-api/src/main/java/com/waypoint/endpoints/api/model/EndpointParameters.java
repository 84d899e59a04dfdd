/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.api.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parameter values supplied for one resolution, keyed by parameter name.
 *
 * <pre>{@code
 * EndpointParameters params = EndpointParameters.builder()
 *     .set("Region", "us-east-1")
 *     .set("UseFIPS", false)
 *     .build();
 * }</pre>
 */
public final class EndpointParameters {

    private static final EndpointParameters EMPTY = new EndpointParameters(Map.of());

    private final Map<String, Value> values;

    private EndpointParameters(Map<String, Value> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static EndpointParameters empty() {
        return EMPTY;
    }

    public static EndpointParameters of(Map<String, Value> values) {
        return new EndpointParameters(new LinkedHashMap<>(values));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, Value> asMap() {
        return values;
    }

    public Value get(String name) {
        return values.get(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EndpointParameters other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "EndpointParameters" + values;
    }

    public static final class Builder {
        private final Map<String, Value> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder set(String name, String value) {
            return set(name, value == null ? null : Value.of(value));
        }

        public Builder set(String name, boolean value) {
            return set(name, Value.of(value));
        }

        public Builder set(String name, List<String> value) {
            return set(name, value == null ? null : Value.ofStrings(value));
        }

        /**
         * Sets a value; {@code null} removes a previously set value.
         */
        public Builder set(String name, Value value) {
            Objects.requireNonNull(name, "name must not be null");
            if (value == null) {
                values.remove(name);
            } else {
                values.put(name, value);
            }
            return this;
        }

        public Builder setAll(Map<String, Value> other) {
            other.forEach(this::set);
            return this;
        }

        public EndpointParameters build() {
            return new EndpointParameters(new LinkedHashMap<>(values));
        }
    }
}
