/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.runtime.evaluation;

import com.waypoint.endpoints.api.model.FailureKind;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Lock-free counters for an {@link EndpointResolver}.
 *
 * <p>Tracks resolutions by outcome, conditions evaluated per call, model
 * errors and an approximate latency distribution.
 */
public final class ResolverMetrics {

    private final LongAdder totalResolutions = new LongAdder();
    private final LongAdder successes = new LongAdder();
    private final Map<FailureKind, LongAdder> failures = new EnumMap<>(FailureKind.class);
    private final LongAdder modelErrors = new LongAdder();
    private final LongAdder totalConditionsEvaluated = new LongAdder();
    private final LongAdder totalResolutionTimeNanos = new LongAdder();

    private final LatencyHistogram latencyHistogram = new LatencyHistogram();

    public ResolverMetrics() {
        for (FailureKind kind : FailureKind.values()) {
            failures.put(kind, new LongAdder());
        }
    }

    public void recordSuccess(long nanos, int conditionsEvaluated) {
        successes.increment();
        record(nanos, conditionsEvaluated);
    }

    public void recordFailure(FailureKind kind, long nanos, int conditionsEvaluated) {
        failures.get(kind).increment();
        record(nanos, conditionsEvaluated);
    }

    /**
     * A call that threw because the model misbehaved.
     */
    public void recordModelError(long nanos) {
        modelErrors.increment();
        totalResolutions.increment();
        totalResolutionTimeNanos.add(nanos);
    }

    private void record(long nanos, int conditionsEvaluated) {
        totalResolutions.increment();
        totalResolutionTimeNanos.add(nanos);
        totalConditionsEvaluated.add(conditionsEvaluated);
        latencyHistogram.record(nanos);
    }

    public long getTotalResolutions() {
        return totalResolutions.sum();
    }

    public long getSuccesses() {
        return successes.sum();
    }

    public long getFailures(FailureKind kind) {
        return failures.get(kind).sum();
    }

    public long getModelErrors() {
        return modelErrors.sum();
    }

    /**
     * Creates a new map instance on every call.
     */
    public Map<String, Object> getSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        long total = totalResolutions.sum();

        snapshot.put("totalResolutions", total);
        snapshot.put("successes", successes.sum());
        for (Map.Entry<FailureKind, LongAdder> entry : failures.entrySet()) {
            snapshot.put("failures." + entry.getKey().name(), entry.getValue().sum());
        }
        snapshot.put("modelErrors", modelErrors.sum());
        snapshot.put("avgResolutionTimeNanos", total > 0 ? totalResolutionTimeNanos.sum() / total : 0);
        snapshot.put("avgConditionsPerResolution", total > 0 ? (double) totalConditionsEvaluated.sum() / total : 0.0);

        snapshot.put("p50LatencyNanos", latencyHistogram.getPercentile(0.50));
        snapshot.put("p95LatencyNanos", latencyHistogram.getPercentile(0.95));
        snapshot.put("p99LatencyNanos", latencyHistogram.getPercentile(0.99));
        return snapshot;
    }

    /**
     * Fixed-bucket histogram, 10µs buckets up to 10ms.
     */
    private static final class LatencyHistogram {
        private static final int NUM_BUCKETS = 1_000;
        private static final long MAX_LATENCY_NANOS = 10_000_000;
        private final LongAdder[] buckets = new LongAdder[NUM_BUCKETS];
        private final LongAdder overflow = new LongAdder();

        LatencyHistogram() {
            for (int i = 0; i < NUM_BUCKETS; i++) {
                buckets[i] = new LongAdder();
            }
        }

        void record(long latencyNanos) {
            if (latencyNanos >= MAX_LATENCY_NANOS) {
                overflow.increment();
                return;
            }
            int bucket = (int) (latencyNanos * NUM_BUCKETS / MAX_LATENCY_NANOS);
            buckets[Math.max(0, Math.min(bucket, NUM_BUCKETS - 1))].increment();
        }

        long getPercentile(double percentile) {
            long total = overflow.sum();
            for (LongAdder bucket : buckets) {
                total += bucket.sum();
            }
            if (total == 0) return 0;

            long target = (long) Math.ceil(total * percentile);
            long cumulative = 0;
            for (int i = 0; i < NUM_BUCKETS; i++) {
                cumulative += buckets[i].sum();
                if (cumulative >= target) {
                    return (long) ((i + 0.5) * MAX_LATENCY_NANOS / NUM_BUCKETS);
                }
            }
            return MAX_LATENCY_NANOS;
        }
    }
}
