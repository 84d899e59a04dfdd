/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.runtime.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Terminal template selected once a decision path completes. The implicit
 * no-match terminal is not a result; see {@link NodeRef#NO_MATCH}.
 */
public sealed interface RuleResult extends Serializable permits RuleResult.EndpointResult, RuleResult.ErrorResult {

    /**
     * @return every top-level expression of this result
     */
    List<Expression> expressions();

    static ErrorResult error(Expression message) {
        return new ErrorResult(message);
    }

    static ErrorResult error(String message) {
        return new ErrorResult(Expression.literal(message));
    }

    static EndpointResult endpoint(Expression url) {
        return new EndpointResult(url, Map.of(), Map.of());
    }

    static EndpointResult endpoint(String url) {
        return endpoint(Expression.literal(url));
    }

    /**
     * An error authored in the rule set, surfaced verbatim to the caller.
     */
    record ErrorResult(Expression message) implements RuleResult {
        public ErrorResult {
            Objects.requireNonNull(message, "message must not be null");
        }

        @Override
        public List<Expression> expressions() {
            return List.of(message);
        }
    }

    /**
     * An endpoint template.
     *
     * @param headers    header name to value expressions, in order
     * @param properties property name to value expression
     */
    record EndpointResult(
            Expression url,
            Map<String, List<Expression>> headers,
            Map<String, Expression> properties
    ) implements RuleResult {
        public EndpointResult {
            Objects.requireNonNull(url, "url must not be null");
            Map<String, List<Expression>> headerCopy = new LinkedHashMap<>();
            headers.forEach((name, values) -> headerCopy.put(name, List.copyOf(values)));
            headers = Collections.unmodifiableMap(headerCopy);
            properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        }

        public EndpointResult withHeader(String name, Expression... values) {
            Map<String, List<Expression>> copy = new LinkedHashMap<>(headers);
            copy.put(name, List.of(values));
            return new EndpointResult(url, copy, properties);
        }

        public EndpointResult withProperty(String name, Expression value) {
            Map<String, Expression> copy = new LinkedHashMap<>(properties);
            copy.put(name, value);
            return new EndpointResult(url, headers, copy);
        }

        @Override
        public List<Expression> expressions() {
            List<Expression> all = new ArrayList<>();
            all.add(url);
            headers.values().forEach(all::addAll);
            all.addAll(properties.values());
            return all;
        }
    }
}
