/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.infra.metrics.impl.inmemory;

import com.waypoint.endpoints.infra.metrics.Timer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps every recording, so percentiles are exact. Meant for tests and short
 * benchmark runs.
 */
final class InMemoryTimer implements Timer {

    private final String name;
    private final List<Duration> recordings = new CopyOnWriteArrayList<>();

    InMemoryTimer(String name) {
        this.name = name;
    }

    @Override
    public <T> T record(Callable<T> callable) throws Exception {
        long startNanos = System.nanoTime();
        try {
            return callable.call();
        } finally {
            recordings.add(Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }

    @Override
    public void record(Duration duration) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Cannot record negative duration: " + duration);
        }
        recordings.add(duration);
    }

    /**
     * Linear interpolation between the closest ranks; {@link Duration#ZERO} when empty.
     */
    @Override
    public Duration percentile(double percentile) {
        if (recordings.isEmpty()) {
            return Duration.ZERO;
        }
        double p = Math.max(0.0, Math.min(1.0, percentile));

        List<Duration> sorted = new ArrayList<>(recordings);
        Collections.sort(sorted);

        double index = (sorted.size() - 1) * p;
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sorted.get(lower);
        }

        long lowerNanos = sorted.get(lower).toNanos();
        long upperNanos = sorted.get(upper).toNanos();
        return Duration.ofNanos(lowerNanos + (long) ((upperNanos - lowerNanos) * (index - lower)));
    }

    List<Duration> getRecordings() {
        return List.copyOf(recordings);
    }

    int count() {
        return recordings.size();
    }

    @Override
    public String toString() {
        return String.format("InMemoryTimer{name='%s', count=%d, p50=%s, p99=%s}",
                name, count(), percentile(0.50), percentile(0.99));
    }
}
