/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.runtime.functions;

import com.waypoint.endpoints.api.exceptions.MalformedModelException;
import com.waypoint.endpoints.api.model.Value;
import com.waypoint.endpoints.api.model.ValueType;

/**
 * Argument checks shared by the built-in functions. Wrong arity or argument
 * types mean the model calls a function incorrectly.
 */
public final class Arguments {

    private Arguments() {
    }

    public static void requireArity(String functionId, Value[] args, int expected) {
        if (args.length != expected) {
            throw new MalformedModelException(String.format(
                    "Function '%s' expects %d argument(s) but got %d", functionId, expected, args.length));
        }
    }

    public static String string(String functionId, Value[] args, int index) {
        return require(functionId, args, index, ValueType.STRING).asString();
    }

    public static boolean bool(String functionId, Value[] args, int index) {
        return require(functionId, args, index, ValueType.BOOLEAN).asBoolean();
    }

    public static int integer(String functionId, Value[] args, int index) {
        return require(functionId, args, index, ValueType.INTEGER).asInteger();
    }

    private static Value require(String functionId, Value[] args, int index, ValueType type) {
        Value value = args[index];
        if (value == null || value.type() != type) {
            throw new MalformedModelException(String.format(
                    "Function '%s' expects %s for argument %d but got %s",
                    functionId, type, index + 1, value == null ? "<absent>" : value.type()));
        }
        return value;
    }
}
