/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.runtime.evaluation;

import com.waypoint.endpoints.api.exceptions.MalformedModelException;
import com.waypoint.endpoints.api.model.Endpoint;
import com.waypoint.endpoints.api.model.ResolutionFailure;
import com.waypoint.endpoints.api.model.ResolutionResult;
import com.waypoint.endpoints.api.model.Value;
import com.waypoint.endpoints.api.model.ValueType;
import com.waypoint.endpoints.runtime.context.EvaluationContext;
import com.waypoint.endpoints.runtime.diagnostics.DiagnosticsCollector;
import com.waypoint.endpoints.runtime.model.Expression;
import com.waypoint.endpoints.runtime.model.NodeRef;
import com.waypoint.endpoints.runtime.model.RuleModel;
import com.waypoint.endpoints.runtime.model.RuleResult;

import java.util.List;
import java.util.Map;

/**
 * Turns the terminal reached by the walker into a {@link ResolutionResult}.
 */
public final class ResultResolver {

    private final RuleModel model;
    private final ExpressionEvaluator expressions;

    public ResultResolver(RuleModel model, ExpressionEvaluator expressions) {
        this.model = model;
        this.expressions = expressions;
    }

    /**
     * @param attachTrace attach the diagnostics trace to a successful result too
     */
    public ResolutionResult render(int terminalRef, EvaluationContext ctx, DiagnosticsCollector diagnostics,
                                   boolean attachTrace) {
        if (NodeRef.isNoMatch(terminalRef)) {
            return ResolutionResult.failure(ResolutionFailure.noRuleMatched(diagnostics.toTrace()));
        }
        if (!NodeRef.isResult(terminalRef)) {
            throw new IllegalArgumentException("Not a terminal: " + terminalRef);
        }

        int resultIndex = NodeRef.resultIndex(terminalRef);
        RuleResult result = model.getResult(resultIndex);
        if (result instanceof RuleResult.ErrorResult error) {
            String message = renderString(error.message(), ctx, diagnostics, "error message of result " + resultIndex);
            return ResolutionResult.failure(ResolutionFailure.ruleDefinedError(message, diagnostics.toTrace()));
        }

        RuleResult.EndpointResult template = (RuleResult.EndpointResult) result;
        Endpoint.Builder endpoint = Endpoint.builder(
                renderString(template.url(), ctx, diagnostics, "URL of result " + resultIndex));

        for (Map.Entry<String, List<Expression>> header : template.headers().entrySet()) {
            for (Expression valueExpression : header.getValue()) {
                Value value = evaluate(valueExpression, ctx, diagnostics);
                if (value != null) {
                    endpoint.addHeader(header.getKey(), asText(value));
                }
            }
        }
        for (Map.Entry<String, Expression> property : template.properties().entrySet()) {
            Value value = evaluate(property.getValue(), ctx, diagnostics);
            if (value != null) {
                endpoint.property(property.getKey(), value);
            }
        }

        return attachTrace
                ? ResolutionResult.success(endpoint.build(), diagnostics.toTrace())
                : ResolutionResult.success(endpoint.build());
    }

    private Value evaluate(Expression expression, EvaluationContext ctx, DiagnosticsCollector diagnostics) {
        return expressions.evaluate(expression, ctx, diagnostics, ExpressionEvaluator.VariableMode.LENIENT);
    }

    private String renderString(Expression expression, EvaluationContext ctx, DiagnosticsCollector diagnostics,
                                String what) {
        Value value = evaluate(expression, ctx, diagnostics);
        if (value == null) {
            throw new MalformedModelException("The " + what + " evaluated to no value");
        }
        return asText(value);
    }

    private static String asText(Value value) {
        return value.type() == ValueType.STRING ? value.asString() : value.render();
    }
}
