/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.runtime.evaluation;

import com.waypoint.endpoints.api.exceptions.MalformedModelException;
import com.waypoint.endpoints.api.model.ArrayValue;
import com.waypoint.endpoints.api.model.RecordValue;
import com.waypoint.endpoints.api.model.Value;
import com.waypoint.endpoints.api.model.ValueType;
import com.waypoint.endpoints.runtime.context.EvaluationContext;
import com.waypoint.endpoints.runtime.diagnostics.DiagnosticsCollector;
import com.waypoint.endpoints.runtime.functions.FunctionDefinition;
import com.waypoint.endpoints.runtime.functions.FunctionRegistry;
import com.waypoint.endpoints.runtime.model.Expression;
import com.waypoint.endpoints.runtime.model.RuleModel;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Evaluates {@link Expression} trees against a call's context.
 *
 * <p>Absent is represented by {@code null}. Two read modes exist for variables:
 * while evaluating condition arguments a never-bound variable is a model defect
 * and throws; while rendering results it reads as absent.
 */
public final class ExpressionEvaluator {

    /**
     * How reads of never-bound variables are treated.
     */
    public enum VariableMode {
        /** Condition arguments: a never-bound variable throws. */
        STRICT,
        /** Result rendering: a never-bound variable reads as absent. */
        LENIENT
    }

    private final RuleModel model;
    private final FunctionRegistry registry;

    public ExpressionEvaluator(RuleModel model, FunctionRegistry registry) {
        this.model = model;
        this.registry = registry;
    }

    /**
     * @return the value, or null for absent
     */
    public Value evaluate(Expression expression, EvaluationContext ctx, DiagnosticsCollector diagnostics, VariableMode mode) {
        if (expression instanceof Expression.Literal literal) {
            return literal.value();
        }
        if (expression instanceof Expression.ParameterRef ref) {
            return ctx.getParameter(slotOf(ref));
        }
        if (expression instanceof Expression.VariableRef ref) {
            return readVariable(ref, ctx, mode);
        }
        if (expression instanceof Expression.FunctionCall call) {
            return invoke(registry.lookup(call.functionId()), call.arguments(), ctx, diagnostics, mode);
        }
        if (expression instanceof Expression.Template template) {
            return evaluateTemplate(template, ctx, diagnostics, mode);
        }
        if (expression instanceof Expression.Coalesce coalesce) {
            return evaluateCoalesce(coalesce, ctx, diagnostics, mode);
        }
        if (expression instanceof Expression.ArrayLiteral array) {
            List<Value> elements = new ArrayList<>(array.elements().size());
            for (Expression element : array.elements()) {
                Value value = evaluate(element, ctx, diagnostics, mode);
                if (value != null) {
                    elements.add(value);
                }
            }
            return new ArrayValue(elements);
        }
        if (expression instanceof Expression.RecordLiteral record) {
            Map<String, Value> members = new LinkedHashMap<>();
            for (Map.Entry<String, Expression> member : record.members().entrySet()) {
                Value value = evaluate(member.getValue(), ctx, diagnostics, mode);
                if (value != null) {
                    members.put(member.getKey(), value);
                }
            }
            return new RecordValue(members);
        }
        throw new IllegalArgumentException("Unknown expression type: " + expression.getClass().getName());
    }

    /**
     * Evaluates arguments left to right, then calls the function once. Unless the
     * function accepts absent arguments, any absent argument yields absent
     * without invoking it.
     */
    public Value invoke(FunctionDefinition definition, List<Expression> arguments,
                        EvaluationContext ctx, DiagnosticsCollector diagnostics, VariableMode mode) {
        Value[] args = new Value[arguments.size()];
        boolean anyAbsent = false;
        for (int i = 0; i < args.length; i++) {
            args[i] = evaluate(arguments.get(i), ctx, diagnostics, mode);
            anyAbsent |= args[i] == null;
        }
        if (anyAbsent && !definition.acceptsAbsentArguments()) {
            return null;
        }
        Optional<Value> result = definition.function().apply(args, diagnostics);
        return result.orElse(null);
    }

    private Value readVariable(Expression.VariableRef ref, EvaluationContext ctx, VariableMode mode) {
        int slot = model.variableSlot(ref.name());
        if (slot < 0) {
            throw new MalformedModelException("Unknown variable '" + ref.name() + "'");
        }
        if (!ctx.isBound(slot)) {
            if (mode == VariableMode.STRICT) {
                throw new MalformedModelException("Variable '" + ref.name() + "' read before the condition binding it was evaluated");
            }
            return null;
        }
        return ctx.getVariable(slot);
    }

    private int slotOf(Expression.ParameterRef ref) {
        int slot = model.parameterSlot(ref.name());
        if (slot < 0) {
            throw new MalformedModelException("Unknown parameter '" + ref.name() + "'");
        }
        return slot;
    }

    private Value evaluateTemplate(Expression.Template template, EvaluationContext ctx,
                                   DiagnosticsCollector diagnostics, VariableMode mode) {
        StringBuilder out = new StringBuilder();
        for (Expression part : template.parts()) {
            Value value = evaluate(part, ctx, diagnostics, mode);
            if (value == null) {
                return null;
            }
            out.append(value.type() == ValueType.STRING ? value.asString() : value.render());
        }
        return Value.of(out.toString());
    }

    /**
     * Every option is evaluated exactly once, in order, even after a present
     * value has been found, so binding side effects and diagnostics do not
     * depend on which option wins.
     */
    private Value evaluateCoalesce(Expression.Coalesce coalesce, EvaluationContext ctx,
                                   DiagnosticsCollector diagnostics, VariableMode mode) {
        Value first = null;
        Value last = null;
        for (Expression option : coalesce.options()) {
            last = evaluate(option, ctx, diagnostics, mode);
            if (first == null) {
                first = last;
            }
        }
        return first != null ? first : last;
    }
}
