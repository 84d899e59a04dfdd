/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.runtime.functions;

import com.waypoint.endpoints.api.exceptions.MalformedModelException;
import com.waypoint.endpoints.api.model.ArrayValue;
import com.waypoint.endpoints.api.model.StructuredValue;
import com.waypoint.endpoints.api.model.Value;
import com.waypoint.endpoints.runtime.diagnostics.DiagnosticsCollector;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Value-level functions: presence tests, equality, attribute access and string
 * slicing.
 */
public final class CoreFunctions {

    public static final String IS_SET = "isSet";
    public static final String NOT = "not";
    public static final String BOOLEAN_EQUALS = "booleanEquals";
    public static final String STRING_EQUALS = "stringEquals";
    public static final String GET_ATTR = "getAttr";
    public static final String SUBSTRING = "substring";
    public static final String SPLIT = "split";

    private CoreFunctions() {
    }

    static Optional<Value> isSet(Value[] args, DiagnosticsCollector diagnostics) {
        Arguments.requireArity(IS_SET, args, 1);
        return Optional.of(Value.of(args[0] != null));
    }

    static Optional<Value> not(Value[] args, DiagnosticsCollector diagnostics) {
        Arguments.requireArity(NOT, args, 1);
        return Optional.of(Value.of(!Arguments.bool(NOT, args, 0)));
    }

    /**
     * Absent equals nothing, not even another absent value.
     */
    static Optional<Value> booleanEquals(Value[] args, DiagnosticsCollector diagnostics) {
        Arguments.requireArity(BOOLEAN_EQUALS, args, 2);
        if (args[0] == null || args[1] == null) {
            return Optional.of(Value.of(false));
        }
        return Optional.of(Value.of(Arguments.bool(BOOLEAN_EQUALS, args, 0) == Arguments.bool(BOOLEAN_EQUALS, args, 1)));
    }

    static Optional<Value> stringEquals(Value[] args, DiagnosticsCollector diagnostics) {
        Arguments.requireArity(STRING_EQUALS, args, 2);
        if (args[0] == null || args[1] == null) {
            return Optional.of(Value.of(false));
        }
        return Optional.of(Value.of(Arguments.string(STRING_EQUALS, args, 0).equals(Arguments.string(STRING_EQUALS, args, 1))));
    }

    /**
     * {@code getAttr(target, "a.b[2]")}. A missing member or an index out of
     * bounds yields absent.
     */
    static Optional<Value> getAttr(Value[] args, DiagnosticsCollector diagnostics) {
        Arguments.requireArity(GET_ATTR, args, 2);
        String path = Arguments.string(GET_ATTR, args, 1);
        Value current = args[0];
        for (PathStep step : parsePath(path)) {
            if (step.name != null) {
                if (!(current instanceof StructuredValue structured)) {
                    diagnostics.reportError("getAttr: cannot read '" + step.name + "' from " + current.type());
                    return Optional.empty();
                }
                current = structured.attribute(step.name);
            } else {
                if (!(current instanceof ArrayValue array)) {
                    diagnostics.reportError("getAttr: cannot index " + current.type());
                    return Optional.empty();
                }
                current = array.get(step.index);
            }
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    /**
     * {@code substring(input, start, stop, reverse)} over ASCII input. With
     * {@code reverse}, offsets count from the end. Yields absent unless
     * {@code 0 <= start < stop <= length}.
     */
    static Optional<Value> substring(Value[] args, DiagnosticsCollector diagnostics) {
        Arguments.requireArity(SUBSTRING, args, 4);
        String input = Arguments.string(SUBSTRING, args, 0);
        int start = Arguments.integer(SUBSTRING, args, 1);
        int stop = Arguments.integer(SUBSTRING, args, 2);
        boolean reverse = Arguments.bool(SUBSTRING, args, 3);

        for (int i = 0; i < input.length(); i++) {
            if (input.charAt(i) > 127) {
                diagnostics.reportError("substring: input contains non-ASCII characters");
                return Optional.empty();
            }
        }
        if (start < 0 || start >= stop || stop > input.length()) {
            return Optional.empty();
        }
        if (reverse) {
            return Optional.of(Value.of(input.substring(input.length() - stop, input.length() - start)));
        }
        return Optional.of(Value.of(input.substring(start, stop)));
    }

    /**
     * {@code split(input, delimiter, limit)}. Limit 0 splits on every occurrence;
     * a positive limit caps the number of parts, the last part keeping the rest.
     * Empty parts are kept.
     */
    static Optional<Value> split(Value[] args, DiagnosticsCollector diagnostics) {
        Arguments.requireArity(SPLIT, args, 3);
        String input = Arguments.string(SPLIT, args, 0);
        String delimiter = Arguments.string(SPLIT, args, 1);
        int limit = Arguments.integer(SPLIT, args, 2);
        if (delimiter.isEmpty()) {
            throw new MalformedModelException("split: delimiter must not be empty");
        }
        if (limit < 0) {
            throw new MalformedModelException("split: limit must not be negative, got " + limit);
        }

        List<String> parts = new ArrayList<>();
        int from = 0;
        while (limit == 0 || parts.size() < limit - 1) {
            int at = input.indexOf(delimiter, from);
            if (at < 0) {
                break;
            }
            parts.add(input.substring(from, at));
            from = at + delimiter.length();
        }
        parts.add(input.substring(from));
        return Optional.of(Value.ofStrings(parts));
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // ATTRIBUTE PATHS
    // ════════════════════════════════════════════════════════════════════════════════

    private static final class PathStep {
        final String name;
        final int index;

        PathStep(String name, int index) {
            this.name = name;
            this.index = index;
        }
    }

    /**
     * Parses {@code name}, {@code name[2]}, {@code [0]} and dotted combinations.
     */
    private static List<PathStep> parsePath(String path) {
        if (path.isEmpty()) {
            throw new MalformedModelException("getAttr: empty path");
        }
        List<PathStep> steps = new ArrayList<>();
        for (String segment : path.split("\\.", -1)) {
            int bracket = segment.indexOf('[');
            String name = bracket < 0 ? segment : segment.substring(0, bracket);
            if (!name.isEmpty()) {
                steps.add(new PathStep(name, -1));
            } else if (bracket < 0) {
                throw new MalformedModelException("getAttr: empty segment in path '" + path + "'");
            }
            while (bracket >= 0) {
                int close = segment.indexOf(']', bracket);
                if (close < 0) {
                    throw new MalformedModelException("getAttr: unclosed '[' in path '" + path + "'");
                }
                try {
                    steps.add(new PathStep(null, Integer.parseInt(segment.substring(bracket + 1, close))));
                } catch (NumberFormatException e) {
                    throw new MalformedModelException("getAttr: invalid index in path '" + path + "'", e);
                }
                int next = close + 1;
                if (next == segment.length()) {
                    break;
                }
                if (segment.charAt(next) != '[') {
                    throw new MalformedModelException("getAttr: unexpected text after ']' in path '" + path + "'");
                }
                bracket = next;
            }
        }
        return steps;
    }
}
