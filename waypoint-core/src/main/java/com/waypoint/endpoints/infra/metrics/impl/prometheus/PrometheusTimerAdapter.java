/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.infra.metrics.impl.prometheus;

import com.waypoint.endpoints.infra.metrics.Timer;
import io.prometheus.client.Histogram;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Bridges {@link Timer} to a Prometheus histogram observed in seconds.
 *
 * <p>Percentiles are left to the server:
 * <pre>
 * histogram_quantile(0.99, rate(waypoint_resolve_latency_seconds_bucket[5m]))
 * </pre>
 */
final class PrometheusTimerAdapter implements Timer {

    private final Histogram.Child histogram;

    PrometheusTimerAdapter(Histogram histogram, String[] labelValues) {
        if (histogram == null) {
            throw new IllegalArgumentException("Histogram cannot be null");
        }
        if (labelValues == null) {
            throw new IllegalArgumentException("Label values cannot be null");
        }
        this.histogram = histogram.labels(labelValues);
    }

    @Override
    public <T> T record(Callable<T> callable) throws Exception {
        if (callable == null) {
            throw new IllegalArgumentException("Callable cannot be null");
        }
        Histogram.Timer timer = histogram.startTimer();
        try {
            return callable.call();
        } finally {
            timer.observeDuration();
        }
    }

    @Override
    public void record(Duration duration) {
        if (duration == null) {
            throw new IllegalArgumentException("Duration cannot be null");
        }
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Duration cannot be negative: " + duration);
        }
        histogram.observe(duration.toNanos() / 1_000_000_000.0);
    }

    @Override
    public Duration percentile(double percentile) {
        throw new UnsupportedOperationException(String.format(Locale.ROOT,
                "Percentiles are calculated by the Prometheus server. "
                        + "Use histogram_quantile(%.2f, rate(<name>_bucket[5m])).", percentile));
    }

    /**
     * Number of observations, the {@code _count} series.
     */
    long count() {
        double[] buckets = histogram.get().buckets;
        return (long) buckets[buckets.length - 1];
    }

    /**
     * Sum of observations in seconds, the {@code _sum} series.
     */
    double sum() {
        return histogram.get().sum;
    }
}
