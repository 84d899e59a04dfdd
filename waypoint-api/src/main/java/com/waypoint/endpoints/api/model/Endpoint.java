/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A resolved endpoint: the connection target plus per-call metadata.
 *
 * <p>Headers keep insertion order and may carry several values each. Properties
 * are opaque to the engine (signing-region overrides, auth scheme lists, ...).
 */
public record Endpoint(
        @JsonProperty("url") String url,
        @JsonProperty("headers") Map<String, List<String>> headers,
        @JsonProperty("properties") Map<String, Value> properties
) implements Serializable {

    public Endpoint {
        Objects.requireNonNull(url, "url must not be null");
        Map<String, List<String>> headerCopy = new LinkedHashMap<>();
        headers.forEach((name, values) -> headerCopy.put(name, List.copyOf(values)));
        headers = Collections.unmodifiableMap(headerCopy);
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public static Endpoint of(String url) {
        return new Endpoint(url, Map.of(), Map.of());
    }

    /**
     * @return the values of a header, or an empty list
     */
    public List<String> header(String name) {
        return headers.getOrDefault(name, List.of());
    }

    /**
     * @return the property value, or null
     */
    public Value property(String name) {
        return properties.get(name);
    }

    public static Builder builder(String url) {
        return new Builder(url);
    }

    public static final class Builder {
        private final String url;
        private final Map<String, List<String>> headers = new LinkedHashMap<>();
        private final Map<String, Value> properties = new LinkedHashMap<>();

        private Builder(String url) {
            this.url = url;
        }

        public Builder addHeader(String name, String value) {
            headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
            return this;
        }

        public Builder property(String name, Value value) {
            properties.put(name, value);
            return this;
        }

        public Endpoint build() {
            return new Endpoint(url, headers, properties);
        }
    }
}
