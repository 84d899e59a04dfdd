/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.runtime.context;

import com.waypoint.endpoints.api.model.Value;
import com.waypoint.endpoints.runtime.model.RuleModel;

/**
 * Per-call evaluation state: parameter values, bound variables and the
 * condition memo.
 *
 * <p>THREAD SAFETY: one instance per resolution call, never shared. A fresh
 * context is allocated for every call so no state can leak between calls.
 *
 * <p>A variable slot is in one of three states: never bound, bound to a value,
 * or bound-and-absent (the binding condition ran and its function produced no
 * value). The {@link #bound} flags keep the last two apart.
 */
public final class EvaluationContext {

    public static final byte UNEVALUATED = 0;
    public static final byte TRUE = 1;
    public static final byte FALSE = 2;

    private final Value[] parameters;
    private final Value[] variables;
    private final boolean[] bound;
    private final byte[] memo; // Map[condition index -> UNEVALUATED | TRUE | FALSE]

    private int conditionsEvaluated;

    public EvaluationContext(RuleModel model) {
        this(model.getParameterCount(), model.getVariableCount(), model.getConditionCount());
    }

    public EvaluationContext(int parameterCount, int variableCount, int conditionCount) {
        this.parameters = new Value[parameterCount];
        this.variables = new Value[variableCount];
        this.bound = new boolean[variableCount];
        this.memo = new byte[conditionCount];
    }

    // --- Parameters ---

    public void setParameter(int slot, Value value) {
        parameters[slot] = value;
    }

    /**
     * @return the parameter value, or null when absent
     */
    public Value getParameter(int slot) {
        return parameters[slot];
    }

    // --- Variables ---

    /**
     * Records a binding. {@code value} may be null (bound-and-absent).
     */
    public void bindVariable(int slot, Value value) {
        variables[slot] = value;
        bound[slot] = true;
    }

    public boolean isBound(int slot) {
        return bound[slot];
    }

    /**
     * @return the bound value, or null when unbound or bound-and-absent
     */
    public Value getVariable(int slot) {
        return variables[slot];
    }

    // --- Condition memo ---

    public byte conditionState(int conditionIndex) {
        return memo[conditionIndex];
    }

    public void recordOutcome(int conditionIndex, boolean outcome) {
        memo[conditionIndex] = outcome ? TRUE : FALSE;
        conditionsEvaluated++;
    }

    /**
     * @return number of fresh condition evaluations in this call
     */
    public int getConditionsEvaluated() {
        return conditionsEvaluated;
    }
}
