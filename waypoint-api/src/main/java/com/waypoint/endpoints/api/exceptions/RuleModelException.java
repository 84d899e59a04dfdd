/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.api.exceptions;

/**
 * Base class for defects in a rule model or its wiring. These are build-time
 * errors: they are raised while a model is constructed, loaded or bound to a
 * function registry, and surface at runtime only for models that bypassed
 * validation.
 *
 * <p>This is a RuntimeException to avoid forcing checked exception handling
 * onto every resolve call site, where these errors cannot be recovered from.
 */
public class RuleModelException extends RuntimeException {

    public RuleModelException(String message) {
        super(message);
    }

    public RuleModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
