/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.runtime.model;

import java.io.Serializable;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * An indexed boolean test: one function applied to argument expressions,
 * optionally binding the function's result to a named variable.
 *
 * @param binding the variable to bind, or null
 */
public record Condition(
        int index,
        String functionId,
        List<Expression> arguments,
        Binding binding
) implements Serializable {

    public Condition {
        if (index < 0) {
            throw new IllegalArgumentException("Condition index must be non-negative: " + index);
        }
        Objects.requireNonNull(functionId, "functionId must not be null");
        arguments = List.copyOf(arguments);
    }

    public static Condition of(int index, String functionId, Expression... arguments) {
        return new Condition(index, functionId, Arrays.asList(arguments), null);
    }

    public Condition bindingTo(Binding newBinding) {
        return new Condition(index, functionId, arguments, newBinding);
    }

    public Condition bindingTo(String name) {
        return bindingTo(Binding.of(name));
    }

    public boolean hasBinding() {
        return binding != null;
    }

    @Override
    public String toString() {
        String call = functionId + arguments.toString().replace('[', '(').replace(']', ')');
        return hasBinding() ? "#" + index + " " + binding.name() + " = " + call : "#" + index + " " + call;
    }
}
