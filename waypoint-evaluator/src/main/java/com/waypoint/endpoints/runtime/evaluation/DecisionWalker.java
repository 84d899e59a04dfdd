/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.runtime.evaluation;

import com.waypoint.endpoints.api.exceptions.MalformedModelException;
import com.waypoint.endpoints.runtime.context.EvaluationContext;
import com.waypoint.endpoints.runtime.diagnostics.DiagnosticsCollector;
import com.waypoint.endpoints.runtime.model.NodeRef;
import com.waypoint.endpoints.runtime.model.RuleModel;

/**
 * Walks the decision diagram from the root to a terminal.
 *
 * <p>Outcomes are memoized per condition index, not per node: when several
 * nodes share a condition, its function runs once per call.
 */
public final class DecisionWalker {

    private final RuleModel model;
    private final ConditionEvaluator conditions;
    private final int stepBudget;

    public DecisionWalker(RuleModel model, ConditionEvaluator conditions, int stepBudget) {
        if (stepBudget <= 0) {
            throw new IllegalArgumentException("stepBudget must be positive, got " + stepBudget);
        }
        this.model = model;
        this.conditions = conditions;
        this.stepBudget = stepBudget;
    }

    /**
     * @return {@link NodeRef#NO_MATCH} or a result ref
     * @throws MalformedModelException if the step budget is exhausted
     */
    public int walk(EvaluationContext ctx, DiagnosticsCollector diagnostics) {
        int ref = model.getRoot();
        int steps = 0;
        while (NodeRef.isNode(ref)) {
            if (++steps > stepBudget) {
                throw new MalformedModelException(String.format(
                        "Traversal exceeded %d steps at node %d; the decision diagram may contain a cycle",
                        stepBudget, ref));
            }
            int conditionIndex = model.nodeCondition(ref);
            byte state = ctx.conditionState(conditionIndex);
            boolean outcome;
            if (state == EvaluationContext.UNEVALUATED) {
                outcome = conditions.evaluate(conditionIndex, ctx, diagnostics);
                ctx.recordOutcome(conditionIndex, outcome);
            } else {
                outcome = state == EvaluationContext.TRUE;
            }
            ref = outcome ? model.highRef(ref) : model.lowRef(ref);
        }
        return ref;
    }

    public int getStepBudget() {
        return stepBudget;
    }
}
