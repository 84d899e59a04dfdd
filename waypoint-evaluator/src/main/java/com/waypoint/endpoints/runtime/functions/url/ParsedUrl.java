/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.runtime.functions.url;

import com.waypoint.endpoints.api.model.StructuredValue;
import com.waypoint.endpoints.api.model.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of {@code parseURL}.
 *
 * @param authority      host and optional port, exactly as written
 * @param path           raw path, possibly empty
 * @param normalizedPath path guaranteed to start and end with {@code /}
 * @param isIp           true if the host is an IPv4 or IPv6 literal
 */
public record ParsedUrl(
        String scheme,
        String authority,
        String path,
        String normalizedPath,
        boolean isIp
) implements StructuredValue {

    @Override
    public Map<String, Value> attributes() {
        Map<String, Value> attributes = new LinkedHashMap<>();
        attributes.put("scheme", Value.of(scheme));
        attributes.put("authority", Value.of(authority));
        attributes.put("path", Value.of(path));
        attributes.put("normalizedPath", Value.of(normalizedPath));
        attributes.put("isIp", Value.of(isIp));
        return attributes;
    }

    @Override
    public String render() {
        return scheme + "://" + authority + path;
    }
}
