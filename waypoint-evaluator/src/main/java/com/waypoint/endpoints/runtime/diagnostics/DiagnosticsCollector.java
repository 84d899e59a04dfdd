/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.runtime.diagnostics;

import com.waypoint.endpoints.api.model.DiagnosticTrace;
import com.waypoint.endpoints.api.model.Value;
import it.unimi.dsi.fastutil.booleans.BooleanArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.ArrayList;
import java.util.List;

/**
 * Call-scoped collector of condition outcomes and function errors.
 *
 * <p>Outcomes are stored column-wise and only materialized into
 * {@link DiagnosticTrace.ConditionOutcome} records by {@link #toTrace()}, so a
 * successful call that never asks for its trace pays for three list appends per
 * condition.
 */
public final class DiagnosticsCollector {

    private final IntArrayList conditionIndices = new IntArrayList();
    private final List<String> functionIds = new ArrayList<>();
    private final List<Value> values = new ArrayList<>();
    private final BooleanArrayList outcomes = new BooleanArrayList();
    private final List<String> errors = new ArrayList<>(2);

    /**
     * Records one fresh condition evaluation.
     *
     * @param value the function result, or null when it produced no value
     */
    public void record(int conditionIndex, String functionId, Value value, boolean outcome) {
        conditionIndices.add(conditionIndex);
        functionIds.add(functionId);
        values.add(value);
        outcomes.add(outcome);
    }

    /**
     * Records why a function produced no value.
     */
    public void reportError(String message) {
        errors.add(message);
    }

    public int size() {
        return conditionIndices.size();
    }

    public List<String> getErrors() {
        return errors;
    }

    public DiagnosticTrace toTrace() {
        List<DiagnosticTrace.ConditionOutcome> recorded = new ArrayList<>(conditionIndices.size());
        for (int i = 0; i < conditionIndices.size(); i++) {
            Value value = values.get(i);
            recorded.add(new DiagnosticTrace.ConditionOutcome(
                    conditionIndices.getInt(i),
                    functionIds.get(i),
                    value == null ? null : value.render(),
                    outcomes.getBoolean(i)));
        }
        return new DiagnosticTrace(recorded, errors);
    }
}
