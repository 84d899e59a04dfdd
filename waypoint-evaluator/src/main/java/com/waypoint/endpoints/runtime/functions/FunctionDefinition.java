/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.runtime.functions;

import com.waypoint.endpoints.api.model.ValueType;

import java.util.Objects;

/**
 * Registry entry for a function.
 *
 * @param needsExtraState        true if the implementation must be initialized
 *                               before use (it must then be a {@link StatefulFunction})
 * @param acceptsAbsentArguments true if the function is invoked even when some
 *                               arguments are absent
 * @param returnType             type used for bindings that do not declare one
 */
public record FunctionDefinition(
        String id,
        EndpointFunction function,
        boolean needsExtraState,
        boolean acceptsAbsentArguments,
        ValueType returnType
) {

    public FunctionDefinition {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(function, "function must not be null");
        returnType = returnType == null ? ValueType.ANY : returnType;
        if (needsExtraState && !(function instanceof StatefulFunction)) {
            throw new IllegalArgumentException("Function '" + id + "' needs extra state but is not a StatefulFunction");
        }
    }

    public static FunctionDefinition of(String id, EndpointFunction function, ValueType returnType) {
        return new FunctionDefinition(id, function, false, false, returnType);
    }

    public static FunctionDefinition absentTolerant(String id, EndpointFunction function, ValueType returnType) {
        return new FunctionDefinition(id, function, false, true, returnType);
    }
}
