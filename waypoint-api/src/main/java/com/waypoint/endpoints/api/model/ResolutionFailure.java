/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Typed failure returned instead of an endpoint. Always carries the diagnostic
 * trace of the call that produced it.
 */
public record ResolutionFailure(
        @JsonProperty("kind") FailureKind kind,
        @JsonProperty("message") String message,
        @JsonProperty("trace") DiagnosticTrace trace
) implements Serializable {

    public static final String NO_RULE_MATCHED_MESSAGE = "No endpoint rule matched";

    public ResolutionFailure {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
        trace = trace == null ? DiagnosticTrace.EMPTY : trace;
    }

    public static ResolutionFailure noRuleMatched(DiagnosticTrace trace) {
        return new ResolutionFailure(FailureKind.NO_RULE_MATCHED, NO_RULE_MATCHED_MESSAGE, trace);
    }

    public static ResolutionFailure ruleDefinedError(String message, DiagnosticTrace trace) {
        return new ResolutionFailure(FailureKind.RULE_DEFINED_ERROR, message, trace);
    }

    public static ResolutionFailure invalidParameters(String message) {
        return new ResolutionFailure(FailureKind.INVALID_PARAMETERS, message, DiagnosticTrace.EMPTY);
    }

    /**
     * Message followed by the last function error, when one was reported.
     */
    public String describe() {
        String lastError = trace.lastError();
        return lastError == null ? message : message + " (caused by: " + lastError + ")";
    }
}
