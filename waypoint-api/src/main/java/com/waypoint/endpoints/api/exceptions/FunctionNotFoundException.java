/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.api.exceptions;

/**
 * Thrown when a model references a function id that is not registered.
 */
public class FunctionNotFoundException extends RuleModelException {

    private final String functionId;

    public FunctionNotFoundException(String functionId) {
        super("No function registered for id '" + functionId + "'"
                + " (hint: custom functions must be registered before the resolver is built)");
        this.functionId = functionId;
    }

    public String getFunctionId() {
        return functionId;
    }
}
