/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.api.exceptions;

import com.waypoint.endpoints.api.model.ResolutionFailure;

/**
 * Unchecked wrapper for callers that prefer exceptions over inspecting a
 * {@link com.waypoint.endpoints.api.model.ResolutionResult}.
 */
public class EndpointResolutionException extends RuntimeException {

    private final transient ResolutionFailure failure;

    public EndpointResolutionException(ResolutionFailure failure) {
        super(failure.describe());
        this.failure = failure;
    }

    public ResolutionFailure getFailure() {
        return failure;
    }
}
