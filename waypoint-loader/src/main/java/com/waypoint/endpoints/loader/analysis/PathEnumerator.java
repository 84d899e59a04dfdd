/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.loader.analysis;

import com.waypoint.endpoints.runtime.model.NodeRef;
import com.waypoint.endpoints.runtime.model.RuleModel;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Enumerates the feasible root-to-terminal paths of a decision diagram.
 *
 * <p>A condition keeps its first outcome for the rest of a walk, so a path that
 * meets the same condition twice must take the same branch both times. Paths
 * that would need two different outcomes are never walked at runtime and are
 * not reported. A result reached only through such paths has no witness.
 *
 * <p>The number of paths grows exponentially with depth. Enumeration stops
 * after {@code maxPaths} paths and marks the report as truncated.
 */
public class PathEnumerator {

    public static final int DEFAULT_MAX_PATHS = 10_000;

    private static final byte UNASSIGNED = 0;
    private static final byte TRUE = 1;
    private static final byte FALSE = 2;

    private final int maxPaths;

    public PathEnumerator() {
        this(DEFAULT_MAX_PATHS);
    }

    public PathEnumerator(int maxPaths) {
        if (maxPaths <= 0) {
            throw new IllegalArgumentException("maxPaths must be positive, got " + maxPaths);
        }
        this.maxPaths = maxPaths;
    }

    public PathReport enumerate(RuleModel model) {
        List<DecisionPath> paths = new ArrayList<>();
        byte[] assignment = new byte[model.getConditionCount()];
        List<Step> steps = new ArrayList<>();
        boolean complete = walk(model, model.getRoot(), assignment, steps, paths);

        RoaringBitmap witnessed = new RoaringBitmap();
        for (DecisionPath path : paths) {
            if (NodeRef.isResult(path.terminal())) {
                witnessed.add(NodeRef.resultIndex(path.terminal()));
            }
        }
        return new PathReport(Collections.unmodifiableList(paths), witnessed, !complete);
    }

    /**
     * @return false once the path limit is hit
     */
    private boolean walk(RuleModel model, int ref, byte[] assignment, List<Step> steps, List<DecisionPath> paths) {
        if (NodeRef.isTerminal(ref)) {
            if (paths.size() >= maxPaths) {
                return false;
            }
            paths.add(new DecisionPath(List.copyOf(steps), ref));
            return true;
        }

        int condition = model.nodeCondition(ref);
        byte known = assignment[condition];
        if (known != UNASSIGNED) {
            // memoized: only the branch of the earlier outcome is walkable
            return walk(model, known == TRUE ? model.highRef(ref) : model.lowRef(ref), assignment, steps, paths);
        }

        for (boolean outcome : new boolean[]{true, false}) {
            assignment[condition] = outcome ? TRUE : FALSE;
            steps.add(new Step(ref, condition, outcome));
            boolean more = walk(model, outcome ? model.highRef(ref) : model.lowRef(ref), assignment, steps, paths);
            steps.remove(steps.size() - 1);
            assignment[condition] = UNASSIGNED;
            if (!more) {
                return false;
            }
        }
        return true;
    }

    /**
     * One fresh condition evaluation along a path.
     */
    public record Step(int node, int conditionIndex, boolean outcome) {
    }

    /**
     * A feasible path and where it ends.
     *
     * @param steps    fresh evaluations in walk order; memoized re-visits are omitted
     * @param terminal result or no-match reference
     */
    public record DecisionPath(List<Step> steps, int terminal) {

        public String describe() {
            StringBuilder sb = new StringBuilder();
            for (Step step : steps) {
                sb.append(step.outcome() ? "" : "!").append('c').append(step.conditionIndex()).append(" -> ");
            }
            return sb.append(NodeRef.describe(terminal)).toString();
        }
    }

    /**
     * @param witnessedResults results with at least one feasible path
     * @param truncated        true if enumeration stopped at the path limit
     */
    public record PathReport(List<DecisionPath> paths, RoaringBitmap witnessedResults, boolean truncated) {

        /**
         * Results without a feasible path. Only meaningful when not truncated.
         */
        public RoaringBitmap resultsWithoutWitness(int resultCount) {
            RoaringBitmap missing = RoaringBitmap.bitmapOfRange(0, resultCount);
            missing.andNot(witnessedResults);
            return missing;
        }
    }
}
