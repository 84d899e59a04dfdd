/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.runtime.evaluation;

import com.waypoint.endpoints.api.exceptions.MalformedModelException;
import com.waypoint.endpoints.api.model.Value;
import com.waypoint.endpoints.api.model.ValueType;
import com.waypoint.endpoints.runtime.context.EvaluationContext;
import com.waypoint.endpoints.runtime.diagnostics.DiagnosticsCollector;
import com.waypoint.endpoints.runtime.functions.FunctionDefinition;
import com.waypoint.endpoints.runtime.functions.FunctionRegistry;
import com.waypoint.endpoints.runtime.model.Binding;
import com.waypoint.endpoints.runtime.model.Condition;
import com.waypoint.endpoints.runtime.model.RuleModel;

/**
 * Evaluates one condition: resolves its arguments, invokes its function once,
 * stores the result under its binding (if any) and reduces the result to a
 * boolean.
 *
 * <p>Function definitions are resolved once at construction so unknown
 * functions surface when the resolver is built, not mid-call.
 */
public final class ConditionEvaluator {

    private final RuleModel model;
    private final ExpressionEvaluator expressions;
    private final FunctionDefinition[] functions; // Map[condition index -> definition]

    public ConditionEvaluator(RuleModel model, FunctionRegistry registry, ExpressionEvaluator expressions) {
        this.model = model;
        this.expressions = expressions;
        this.functions = new FunctionDefinition[model.getConditionCount()];
        for (int i = 0; i < functions.length; i++) {
            functions[i] = registry.lookup(model.getCondition(i).functionId());
        }
    }

    public boolean evaluate(int conditionIndex, EvaluationContext ctx, DiagnosticsCollector diagnostics) {
        Condition condition = model.getCondition(conditionIndex);
        FunctionDefinition definition = functions[conditionIndex];

        Value result = expressions.invoke(definition, condition.arguments(), ctx, diagnostics,
                ExpressionEvaluator.VariableMode.STRICT);

        int slot = model.bindingSlot(conditionIndex);
        if (slot >= 0) {
            Binding binding = condition.binding();
            if (result != null && !binding.type().accepts(result.type())) {
                throw new MalformedModelException(String.format(
                        "Condition #%d binds '%s' as %s but %s returned %s",
                        conditionIndex, binding.name(), binding.type(), definition.id(), result.type()));
            }
            ctx.bindVariable(slot, result);
        }

        boolean outcome = isTruthy(result);
        diagnostics.record(conditionIndex, definition.id(), result, outcome);
        return outcome;
    }

    /**
     * Absent and {@code false} are false; every other present value, including
     * the empty string, is true.
     */
    static boolean isTruthy(Value result) {
        if (result == null) {
            return false;
        }
        if (result.type() == ValueType.BOOLEAN) {
            return result.asBoolean();
        }
        return true;
    }
}
