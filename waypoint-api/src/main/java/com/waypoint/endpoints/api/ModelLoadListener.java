/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.api;

import java.util.Map;

/**
 * Callback interface for model-loading stage events.
 *
 * <p>Loading runs three stages:
 * <ol>
 *   <li>PARSING - read JSON and convert parameters, conditions, results and nodes</li>
 *   <li>VALIDATION - structural checks while building the {@code RuleModel}</li>
 *   <li>ANALYSIS - reachability statistics over the built model</li>
 * </ol>
 */
public interface ModelLoadListener {

    void onStageStart(String stageName, int stageNumber, int totalStages);

    void onStageComplete(String stageName, StageResult result);

    void onError(String stageName, Exception error);

    /**
     * Result of a single load stage.
     *
     * @param metrics stage-specific metrics (e.g., "nodeCount", "unreachableResults")
     */
    record StageResult(String stageName, long durationNanos, Map<String, Object> metrics) {

        public long durationMillis() {
            return durationNanos / 1_000_000;
        }
    }
}
