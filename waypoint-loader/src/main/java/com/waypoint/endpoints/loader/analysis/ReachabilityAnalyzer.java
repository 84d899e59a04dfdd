/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.loader.analysis;

import com.waypoint.endpoints.runtime.model.NodeRef;
import com.waypoint.endpoints.runtime.model.RuleModel;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.roaringbitmap.RoaringBitmap;

import java.util.Map;

/**
 * Computes which nodes, conditions and results can be reached from the root of
 * a decision diagram, ignoring condition outcomes.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ReachabilityReport report = new ReachabilityAnalyzer().analyze(model);
 * if (report.hasUnreachableResults()) {
 *     logger.warn("Dead results: {}", report.unreachableResults());
 * }
 * }</pre>
 */
public class ReachabilityAnalyzer {

    public ReachabilityReport analyze(RuleModel model) {
        RoaringBitmap nodes = new RoaringBitmap();
        RoaringBitmap conditions = new RoaringBitmap();
        RoaringBitmap results = new RoaringBitmap();
        boolean noMatchReachable = false;

        IntArrayList stack = new IntArrayList();
        stack.add(model.getRoot());
        while (!stack.isEmpty()) {
            int ref = stack.popInt();
            if (NodeRef.isNoMatch(ref)) {
                noMatchReachable = true;
            } else if (NodeRef.isResult(ref)) {
                results.add(NodeRef.resultIndex(ref));
            } else if (nodes.checkedAdd(ref)) {
                conditions.add(model.nodeCondition(ref));
                stack.add(model.highRef(ref));
                stack.add(model.lowRef(ref));
            }
        }

        return new ReachabilityReport(
                nodes,
                conditions,
                results,
                complement(nodes, model.getNodeCount()),
                complement(conditions, model.getConditionCount()),
                complement(results, model.getResultCount()),
                noMatchReachable);
    }

    private static RoaringBitmap complement(RoaringBitmap reached, int size) {
        RoaringBitmap missing = RoaringBitmap.bitmapOfRange(0, size);
        missing.andNot(reached);
        return missing;
    }

    /**
     * Reachable and unreachable element sets of one model.
     *
     * @param noMatchReachable true if some path ends without a result
     */
    public record ReachabilityReport(
            RoaringBitmap reachableNodes,
            RoaringBitmap reachableConditions,
            RoaringBitmap reachableResults,
            RoaringBitmap unreachableNodes,
            RoaringBitmap unreachableConditions,
            RoaringBitmap unreachableResults,
            boolean noMatchReachable
    ) {

        public boolean hasUnreachableResults() {
            return !unreachableResults.isEmpty();
        }

        public boolean hasUnreachableConditions() {
            return !unreachableConditions.isEmpty();
        }

        /**
         * Counts suitable for span attributes and load listeners.
         */
        public Map<String, Object> toMetrics() {
            return Map.of(
                    "reachableNodes", reachableNodes.getCardinality(),
                    "reachableResults", reachableResults.getCardinality(),
                    "unreachableNodes", unreachableNodes.getCardinality(),
                    "unreachableConditions", unreachableConditions.getCardinality(),
                    "unreachableResults", unreachableResults.getCardinality(),
                    "noMatchReachable", noMatchReachable);
        }
    }
}
