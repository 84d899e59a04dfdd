/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.infra.metrics.impl.prometheus;

import com.waypoint.endpoints.infra.metrics.Counter;
import com.waypoint.endpoints.infra.metrics.Gauge;
import com.waypoint.endpoints.infra.metrics.MetricsRegistry;
import com.waypoint.endpoints.infra.metrics.Timer;
import com.waypoint.endpoints.infra.metrics.internal.Tags;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Histogram;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link MetricsRegistry} over the Prometheus simpleclient.
 *
 * <p>One collector is registered per sanitized name, with the tag keys as
 * label names; each distinct set of tag values gets its own child. Timers are
 * histograms named {@code <name>_seconds}.
 */
public final class PrometheusMetricsRegistry implements MetricsRegistry {

    static final double[] LATENCY_BUCKETS = {
            0.000_01, 0.000_05, 0.000_1, 0.000_5, 0.001, 0.005, 0.01, 0.05, 0.1, 0.5, 1.0};

    private final CollectorRegistry registry;

    private final Map<String, io.prometheus.client.Counter> counterCollectors = new ConcurrentHashMap<>();
    private final Map<String, io.prometheus.client.Gauge> gaugeCollectors = new ConcurrentHashMap<>();
    private final Map<String, Histogram> timerCollectors = new ConcurrentHashMap<>();

    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Gauge> gauges = new ConcurrentHashMap<>();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();

    public PrometheusMetricsRegistry() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusMetricsRegistry(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Counter counter(String name, String... tags) {
        return counters.computeIfAbsent(Tags.meterKey(name, tags), key -> {
            io.prometheus.client.Counter collector = counterCollectors.computeIfAbsent(sanitizeName(name),
                    n -> io.prometheus.client.Counter.build()
                            .name(n)
                            .help("Counter " + name)
                            .labelNames(Tags.names(tags))
                            .register(registry));
            return new PrometheusCounterAdapter(collector, Tags.values(tags));
        });
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return gauges.computeIfAbsent(Tags.meterKey(name, tags), key -> {
            io.prometheus.client.Gauge collector = gaugeCollectors.computeIfAbsent(sanitizeName(name),
                    n -> io.prometheus.client.Gauge.build()
                            .name(n)
                            .help("Gauge " + name)
                            .labelNames(Tags.names(tags))
                            .register(registry));
            return new PrometheusGaugeAdapter(collector, Tags.values(tags));
        });
    }

    @Override
    public Timer timer(String name, String... tags) {
        return timers.computeIfAbsent(Tags.meterKey(name, tags), key -> {
            Histogram collector = timerCollectors.computeIfAbsent(sanitizeName(name) + "_seconds",
                    n -> Histogram.build()
                            .name(n)
                            .help("Timer " + name)
                            .buckets(LATENCY_BUCKETS)
                            .labelNames(Tags.names(tags))
                            .register(registry));
            return new PrometheusTimerAdapter(collector, Tags.values(tags));
        });
    }

    public CollectorRegistry getCollectorRegistry() {
        return registry;
    }

    static String sanitizeName(String name) {
        return name.toLowerCase()
                .replaceAll("[^a-z0-9_:]", "_")
                .replaceAll("_{2,}", "_");
    }
}
