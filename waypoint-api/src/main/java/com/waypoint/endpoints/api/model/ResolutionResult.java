/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.waypoint.endpoints.api.exceptions.EndpointResolutionException;

import java.io.Serializable;

/**
 * Outcome of a single resolution: either an {@link Endpoint} or a
 * {@link ResolutionFailure}, never both.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ResolutionResult result = resolver.resolve(params);
 * if (result.isSuccess()) {
 *     connect(result.endpoint().url());
 * } else {
 *     log.warn("endpoint resolution failed: {}", result.failure().describe());
 * }
 * }</pre>
 *
 * @param trace diagnostics for successful traced calls; failures carry theirs inside {@link #failure()}
 */
public record ResolutionResult(
        @JsonProperty("endpoint") Endpoint endpoint,
        @JsonProperty("failure") ResolutionFailure failure,
        @JsonProperty("trace") DiagnosticTrace trace
) implements Serializable {

    public ResolutionResult {
        if ((endpoint == null) == (failure == null)) {
            throw new IllegalArgumentException("Exactly one of endpoint or failure must be set");
        }
        if (trace == null) {
            trace = failure != null ? failure.trace() : DiagnosticTrace.EMPTY;
        }
    }

    public static ResolutionResult success(Endpoint endpoint) {
        return new ResolutionResult(endpoint, null, DiagnosticTrace.EMPTY);
    }

    public static ResolutionResult success(Endpoint endpoint, DiagnosticTrace trace) {
        return new ResolutionResult(endpoint, null, trace);
    }

    public static ResolutionResult failure(ResolutionFailure failure) {
        return new ResolutionResult(null, failure, failure.trace());
    }

    @JsonIgnore
    public boolean isSuccess() {
        return endpoint != null;
    }

    /**
     * @return the endpoint
     * @throws EndpointResolutionException if resolution failed
     */
    public Endpoint orElseThrow() {
        if (failure != null) {
            throw new EndpointResolutionException(failure);
        }
        return endpoint;
    }
}
