/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.api.model;

/**
 * Expected, per-call reasons why resolution produced no endpoint.
 */
public enum FailureKind {
    /**
     * The decision diagram reached the no-match terminal.
     */
    NO_RULE_MATCHED,

    /**
     * The reached result is an error result authored in the rule set.
     */
    RULE_DEFINED_ERROR,

    /**
     * The supplied parameters do not satisfy the model's declarations
     * (missing required value, wrong type).
     */
    INVALID_PARAMETERS
}
