/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.infra.monitoring;

import com.waypoint.endpoints.api.IEndpointResolver;
import com.waypoint.endpoints.api.model.EndpointParameters;
import com.waypoint.endpoints.api.model.FailureKind;
import com.waypoint.endpoints.api.model.ResolutionResult;
import com.waypoint.endpoints.infra.metrics.Counter;
import com.waypoint.endpoints.infra.metrics.MetricsRegistry;
import com.waypoint.endpoints.infra.metrics.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Decorator that reports every resolution to a {@link MetricsRegistry}.
 *
 * <p>Meters, tagged with {@code outcome} = {@code SUCCESS}, a {@link FailureKind}
 * name or {@code MODEL_ERROR}:
 * <ul>
 *   <li>{@value #RESOLUTIONS} - counter</li>
 *   <li>{@value #LATENCY} - timer</li>
 * </ul>
 * Meters are looked up once, at construction.
 */
public final class InstrumentedEndpointResolver implements IEndpointResolver {

    public static final String RESOLUTIONS = "waypoint.resolutions";
    public static final String LATENCY = "waypoint.resolve.latency";

    static final String SUCCESS = "SUCCESS";
    static final String MODEL_ERROR = "MODEL_ERROR";

    private final IEndpointResolver delegate;

    private final Outcome success;
    private final Outcome modelError;
    private final Map<FailureKind, Outcome> failures = new EnumMap<>(FailureKind.class);

    private record Outcome(Counter count, Timer latency) {
        void record(long nanos) {
            count.increment();
            latency.record(Duration.ofNanos(nanos));
        }
    }

    public InstrumentedEndpointResolver(IEndpointResolver delegate, MetricsRegistry metrics) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        Objects.requireNonNull(metrics, "metrics must not be null");
        this.success = outcome(metrics, SUCCESS);
        this.modelError = outcome(metrics, MODEL_ERROR);
        for (FailureKind kind : FailureKind.values()) {
            failures.put(kind, outcome(metrics, kind.name()));
        }
    }

    private static Outcome outcome(MetricsRegistry metrics, String tag) {
        return new Outcome(metrics.counter(RESOLUTIONS, "outcome", tag), metrics.timer(LATENCY, "outcome", tag));
    }

    @Override
    public ResolutionResult resolve(EndpointParameters parameters) {
        long start = System.nanoTime();
        try {
            return record(delegate.resolve(parameters), start);
        } catch (RuntimeException e) {
            modelError.record(System.nanoTime() - start);
            throw e;
        }
    }

    @Override
    public ResolutionResult resolveWithTrace(EndpointParameters parameters) {
        long start = System.nanoTime();
        try {
            return record(delegate.resolveWithTrace(parameters), start);
        } catch (RuntimeException e) {
            modelError.record(System.nanoTime() - start);
            throw e;
        }
    }

    private ResolutionResult record(ResolutionResult result, long start) {
        long elapsed = System.nanoTime() - start;
        if (result.isSuccess()) {
            success.record(elapsed);
        } else {
            failures.get(result.failure().kind()).record(elapsed);
        }
        return result;
    }

    public IEndpointResolver getDelegate() {
        return delegate;
    }
}
