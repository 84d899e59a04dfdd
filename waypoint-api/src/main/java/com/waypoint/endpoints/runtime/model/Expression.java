/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.runtime.model;

import com.waypoint.endpoints.api.model.Value;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Expression language used by condition arguments and result templates.
 *
 * <p>Expressions are immutable trees. Evaluation may yield "absent" (no value):
 * an unset optional parameter, an unset variable, or a function that produced
 * nothing. {@link Coalesce} is the only construct that recovers from absence.
 */
public sealed interface Expression extends Serializable
        permits Expression.Literal, Expression.ParameterRef, Expression.VariableRef,
        Expression.FunctionCall, Expression.Template, Expression.Coalesce,
        Expression.ArrayLiteral, Expression.RecordLiteral {

    /**
     * @return direct sub-expressions, in evaluation order
     */
    List<Expression> children();

    /**
     * Visits this expression and all its descendants, depth first, parent before children.
     */
    default void walk(Consumer<Expression> visitor) {
        visitor.accept(this);
        for (Expression child : children()) {
            child.walk(visitor);
        }
    }

    static Literal literal(Value value) {
        return new Literal(value);
    }

    static Literal literal(String value) {
        return new Literal(Value.of(value));
    }

    static Literal literal(boolean value) {
        return new Literal(Value.of(value));
    }

    static Literal literal(int value) {
        return new Literal(Value.of(value));
    }

    static ParameterRef param(String name) {
        return new ParameterRef(name);
    }

    static VariableRef variable(String name) {
        return new VariableRef(name);
    }

    static FunctionCall call(String functionId, Expression... arguments) {
        return new FunctionCall(functionId, Arrays.asList(arguments));
    }

    static Template template(Expression... parts) {
        return new Template(Arrays.asList(parts));
    }

    static Coalesce coalesce(Expression... options) {
        return new Coalesce(Arrays.asList(options));
    }

    /**
     * Constant value. Never absent.
     */
    record Literal(Value value) implements Expression {
        public Literal {
            Objects.requireNonNull(value, "literal value must not be null");
        }

        @Override
        public List<Expression> children() {
            return List.of();
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    /**
     * Reads a declared parameter. Absent when the parameter is optional, has no
     * default and was not supplied.
     */
    record ParameterRef(String name) implements Expression {
        public ParameterRef {
            Objects.requireNonNull(name, "parameter name must not be null");
        }

        @Override
        public List<Expression> children() {
            return List.of();
        }

        @Override
        public String toString() {
            return "{" + name + "}";
        }
    }

    /**
     * Reads a variable bound by a condition earlier in the same call.
     */
    record VariableRef(String name) implements Expression {
        public VariableRef {
            Objects.requireNonNull(name, "variable name must not be null");
        }

        @Override
        public List<Expression> children() {
            return List.of();
        }

        @Override
        public String toString() {
            return "$" + name;
        }
    }

    /**
     * Invokes a registered function.
     */
    record FunctionCall(String functionId, List<Expression> arguments) implements Expression {
        public FunctionCall {
            Objects.requireNonNull(functionId, "function id must not be null");
            arguments = List.copyOf(arguments);
        }

        @Override
        public List<Expression> children() {
            return arguments;
        }

        @Override
        public String toString() {
            return functionId + arguments.toString().replace('[', '(').replace(']', ')');
        }
    }

    /**
     * String concatenation of its parts. Absent if any part is absent.
     */
    record Template(List<Expression> parts) implements Expression {
        public Template {
            parts = List.copyOf(parts);
        }

        @Override
        public List<Expression> children() {
            return parts;
        }
    }

    /**
     * First present value among its options, else the last option's value. Every
     * option is evaluated exactly once, including those after the winner.
     */
    record Coalesce(List<Expression> options) implements Expression {
        public Coalesce {
            options = List.copyOf(options);
            if (options.isEmpty()) {
                throw new IllegalArgumentException("coalesce requires at least one option");
            }
        }

        @Override
        public List<Expression> children() {
            return options;
        }
    }

    /**
     * Array built from its elements; absent elements are dropped.
     */
    record ArrayLiteral(List<Expression> elements) implements Expression {
        public ArrayLiteral {
            elements = List.copyOf(elements);
        }

        @Override
        public List<Expression> children() {
            return elements;
        }
    }

    /**
     * Record built from named members; absent members are dropped.
     */
    record RecordLiteral(Map<String, Expression> members) implements Expression {
        public RecordLiteral {
            members = Collections.unmodifiableMap(new LinkedHashMap<>(members));
        }

        @Override
        public List<Expression> children() {
            return new ArrayList<>(members.values());
        }
    }
}
