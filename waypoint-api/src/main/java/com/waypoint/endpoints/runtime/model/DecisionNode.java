/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.runtime.model;

import java.io.Serializable;

/**
 * Binary branch of the decision diagram: evaluate {@code conditionIndex}, follow
 * {@code highRef} when true and {@code lowRef} when false. Refs use the
 * {@link NodeRef} encoding.
 */
public record DecisionNode(int conditionIndex, int highRef, int lowRef) implements Serializable {

    @Override
    public String toString() {
        return "[" + conditionIndex + ", " + highRef + ", " + lowRef + "]";
    }
}
