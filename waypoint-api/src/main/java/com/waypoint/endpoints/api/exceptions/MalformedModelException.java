/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.api.exceptions;

/**
 * Thrown when a rule model is structurally invalid: out-of-range node, condition
 * or result indices, a cyclic decision diagram, unknown parameter or variable
 * names, or a condition reading a variable that is not bound on every path
 * reaching it.
 */
public class MalformedModelException extends RuleModelException {

    public MalformedModelException(String message) {
        super(message);
    }

    public MalformedModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
