/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Call-scoped record of every condition evaluated during one resolution, in
 * evaluation order, plus the errors functions reported while producing no value.
 *
 * <p>Memoized re-uses of a condition are not repeated in the trace.
 */
public record DiagnosticTrace(
        @JsonProperty("condition_outcomes") List<ConditionOutcome> conditionOutcomes,
        @JsonProperty("function_errors") List<String> functionErrors
) implements Serializable {

    public static final DiagnosticTrace EMPTY = new DiagnosticTrace(List.of(), List.of());

    public DiagnosticTrace {
        conditionOutcomes = List.copyOf(conditionOutcomes);
        functionErrors = List.copyOf(functionErrors);
    }

    public int conditionsEvaluated() {
        return conditionOutcomes.size();
    }

    public boolean isEmpty() {
        return conditionOutcomes.isEmpty() && functionErrors.isEmpty();
    }

    /**
     * @return the most recent function error, or null
     */
    public String lastError() {
        return functionErrors.isEmpty() ? null : functionErrors.get(functionErrors.size() - 1);
    }

    /**
     * Outcome of one fresh condition evaluation.
     *
     * @param value rendered function result, or null when it produced no value
     */
    public record ConditionOutcome(
            @JsonProperty("condition_index") int conditionIndex,
            @JsonProperty("function") String functionId,
            @JsonProperty("value") String value,
            @JsonProperty("outcome") boolean outcome
    ) implements Serializable {

        public String describe() {
            String rendered = value == null ? "<absent>" : value;
            return String.format("%s #%d %s -> %s", outcome ? "✓" : "✗", conditionIndex, functionId, rendered);
        }
    }
}
