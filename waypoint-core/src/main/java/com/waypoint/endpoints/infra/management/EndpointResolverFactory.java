/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.infra.management;

import com.waypoint.endpoints.api.IEndpointResolver;
import com.waypoint.endpoints.api.exceptions.ModelLoadException;
import com.waypoint.endpoints.config.ResolverConfig;
import com.waypoint.endpoints.infra.metrics.MetricsRegistry;
import com.waypoint.endpoints.infra.monitoring.InstrumentedEndpointResolver;
import com.waypoint.endpoints.loader.RuleModelLoader;
import com.waypoint.endpoints.runtime.evaluation.EndpointResolver;
import com.waypoint.endpoints.runtime.functions.FunctionRegistry;
import com.waypoint.endpoints.runtime.model.RuleModel;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Wires loader, function registry, configuration and tracer into resolvers.
 *
 * <p>{@link EndpointResolver} freezes the registry it is given, so every resolver
 * gets a fresh one from the registry supplier.
 *
 * <pre>{@code
 * EndpointResolverFactory factory = EndpointResolverFactory.defaults();
 * try (RuleModelManager manager = factory.manage(Path.of("rules/s3.json"))) {
 *     manager.start();
 *     ResolutionResult result = manager.resolve(parameters);
 * }
 * }</pre>
 */
public final class EndpointResolverFactory {

    private final ResolverConfig config;
    private final Tracer tracer;
    private final Supplier<FunctionRegistry> registrySupplier;
    private final MetricsRegistry metrics;

    public EndpointResolverFactory(ResolverConfig config, Tracer tracer,
                                   Supplier<FunctionRegistry> registrySupplier, MetricsRegistry metrics) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.registrySupplier = Objects.requireNonNull(registrySupplier, "registrySupplier must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    public EndpointResolverFactory(ResolverConfig config, Tracer tracer) {
        this(config, tracer, () -> FunctionRegistry.standard(config), MetricsRegistry.getInstance());
    }

    /**
     * Configuration from {@code waypoint.properties} and the environment, no-op tracing.
     */
    public static EndpointResolverFactory defaults() {
        return new EndpointResolverFactory(ResolverConfig.loadDefault(),
                OpenTelemetry.noop().getTracer("waypoint-core"));
    }

    public RuleModelLoader newLoader() {
        return new RuleModelLoader(registrySupplier.get(), tracer);
    }

    /**
     * @throws com.waypoint.endpoints.api.exceptions.FunctionNotFoundException if the
     *         model uses a function the registry does not provide
     */
    public EndpointResolver create(RuleModel model) {
        return new EndpointResolver(model, registrySupplier.get(), config, tracer);
    }

    /**
     * A resolver that also reports to the metrics registry.
     */
    public IEndpointResolver createInstrumented(RuleModel model) {
        return new InstrumentedEndpointResolver(create(model), metrics);
    }

    public EndpointResolver load(Path modelPath) throws ModelLoadException {
        return create(newLoader().load(modelPath));
    }

    public EndpointResolver load(InputStream json) throws ModelLoadException {
        return create(newLoader().load(json));
    }

    /**
     * Loads {@code modelPath} now and returns a manager ready to watch it. Call
     * {@link RuleModelManager#start()} to begin polling.
     */
    public RuleModelManager manage(Path modelPath) throws ModelLoadException {
        return new RuleModelManager(modelPath, tracer, newLoader(), this::createInstrumented,
                config.getReloadIntervalSeconds(), metrics);
    }

    public ResolverConfig getConfig() {
        return config;
    }

    public MetricsRegistry getMetrics() {
        return metrics;
    }
}
