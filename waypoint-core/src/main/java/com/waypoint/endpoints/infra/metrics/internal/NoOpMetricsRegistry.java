/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.infra.metrics.internal;

import com.waypoint.endpoints.infra.metrics.Counter;
import com.waypoint.endpoints.infra.metrics.Gauge;
import com.waypoint.endpoints.infra.metrics.MetricsRegistry;
import com.waypoint.endpoints.infra.metrics.Timer;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Fallback used when no provider is on the class path.
 */
final class NoOpMetricsRegistry implements MetricsRegistry {

    private static final Counter COUNTER = new NoOpCounter();
    private static final Gauge GAUGE = new NoOpGauge();
    private static final Timer TIMER = new NoOpTimer();

    @Override
    public Counter counter(String name, String... tags) {
        return COUNTER;
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return GAUGE;
    }

    @Override
    public Timer timer(String name, String... tags) {
        return TIMER;
    }

    private static final class NoOpCounter implements Counter {
        @Override
        public void increment() {
        }

        @Override
        public void increment(long amount) {
        }

        @Override
        public long count() {
            return 0;
        }
    }

    private static final class NoOpGauge implements Gauge {
        @Override
        public void set(double value) {
        }

        @Override
        public double value() {
            return 0;
        }
    }

    private static final class NoOpTimer implements Timer {
        @Override
        public <T> T record(Callable<T> callable) throws Exception {
            return callable.call();
        }

        @Override
        public void record(Duration duration) {
        }

        @Override
        public Duration percentile(double percentile) {
            return Duration.ZERO;
        }
    }
}
