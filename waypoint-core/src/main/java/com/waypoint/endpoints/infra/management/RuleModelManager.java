/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.infra.management;

import com.waypoint.endpoints.api.IEndpointResolver;
import com.waypoint.endpoints.api.IRuleModelLoader;
import com.waypoint.endpoints.api.ModelLoadListener;
import com.waypoint.endpoints.api.exceptions.ModelLoadException;
import com.waypoint.endpoints.api.model.EndpointParameters;
import com.waypoint.endpoints.api.model.ResolutionResult;
import com.waypoint.endpoints.infra.metrics.MetricsRegistry;
import com.waypoint.endpoints.runtime.model.RuleModel;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Owns the active rule model for one file and hot-swaps it when the file changes.
 *
 * <p>The first load happens in the constructor and fails fast. Later loads
 * (polling or {@link #reload(ModelLoadListener)}) replace the active resolver
 * only on success; a model that fails to load or to build leaves the previous
 * one serving.
 *
 * <p><b>Performance Note:</b>
 * The active model and its resolver are published together through one
 * {@link AtomicReference}. {@link #resolve(EndpointParameters)} reads it once,
 * so a call that overlaps a swap runs entirely against the old or the new
 * model, never a mix, and takes no lock.
 */
public class RuleModelManager implements IEndpointResolver, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(RuleModelManager.class);

    static final String RELOADS = "waypoint.model.reloads";
    static final String NODE_COUNT = "waypoint.model.nodes";

    private final Path modelPath;
    private final IRuleModelLoader loader;
    private final Function<RuleModel, ? extends IEndpointResolver> resolverFactory;
    private final long reloadIntervalSeconds;
    private final Tracer tracer;
    private final MetricsRegistry metrics;

    private final AtomicReference<ActiveModel> active = new AtomicReference<>();
    private final ScheduledExecutorService monitoringExecutor;

    private volatile long lastModifiedTime = -1;
    private volatile Consumer<IEndpointResolver> warmupCallback;

    /**
     * A model and the resolver built from it.
     */
    public record ActiveModel(RuleModel model, IEndpointResolver resolver) {
    }

    public RuleModelManager(Path modelPath, Tracer tracer, IRuleModelLoader loader,
                            Function<RuleModel, ? extends IEndpointResolver> resolverFactory,
                            long reloadIntervalSeconds, MetricsRegistry metrics) throws ModelLoadException {
        if (reloadIntervalSeconds <= 0) {
            throw new IllegalArgumentException("reloadIntervalSeconds must be positive, got " + reloadIntervalSeconds);
        }
        this.modelPath = Objects.requireNonNull(modelPath, "modelPath must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.loader = Objects.requireNonNull(loader, "loader must not be null");
        this.resolverFactory = Objects.requireNonNull(resolverFactory, "resolverFactory must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.reloadIntervalSeconds = reloadIntervalSeconds;
        this.loader.setTracer(tracer);
        this.monitoringExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Rule-Model-Monitor");
            t.setDaemon(true);
            return t;
        });

        reloadInternal(); // Initial load, fail fast
    }

    public RuleModelManager(Path modelPath, Tracer tracer, IRuleModelLoader loader,
                            Function<RuleModel, ? extends IEndpointResolver> resolverFactory) throws ModelLoadException {
        this(modelPath, tracer, loader, resolverFactory, 10, MetricsRegistry.getInstance());
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // RESOLUTION (delegates to the active model)
    // ════════════════════════════════════════════════════════════════════════════════

    @Override
    public ResolutionResult resolve(EndpointParameters parameters) {
        return active.get().resolver().resolve(parameters);
    }

    @Override
    public ResolutionResult resolveWithTrace(EndpointParameters parameters) {
        return active.get().resolver().resolveWithTrace(parameters);
    }

    public RuleModel getRuleModel() {
        return active.get().model();
    }

    public IEndpointResolver getResolver() {
        return active.get().resolver();
    }

    public ActiveModel getActiveModel() {
        return active.get();
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ════════════════════════════════════════════════════════════════════════════════

    /**
     * Sets a callback run against each newly loaded resolver before it is
     * published. A failing callback is logged and does not block the swap.
     */
    public void setWarmupCallback(Consumer<IEndpointResolver> callback) {
        this.warmupCallback = callback;
    }

    public void start() {
        monitoringExecutor.scheduleAtFixedRate(this::checkForUpdates,
                reloadIntervalSeconds, reloadIntervalSeconds, TimeUnit.SECONDS);
        logger.info("Watching {} for changes every {}s", modelPath, reloadIntervalSeconds);
    }

    public void shutdown() {
        monitoringExecutor.shutdown();
    }

    @Override
    public void close() {
        shutdown();
    }

    /**
     * Reloads now, reporting load stages to {@code listener}.
     *
     * @throws ModelLoadException if the file cannot be loaded; the previous model stays active
     */
    public void reload(ModelLoadListener listener) throws ModelLoadException {
        Span span = tracer.spanBuilder("manual-reload").startSpan();
        try (Scope scope = span.makeCurrent()) {
            loader.setLoadListener(listener);
            try {
                reloadInternal();
            } finally {
                loader.setLoadListener(null);
            }
        } catch (ModelLoadException | RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }

    void checkForUpdates() {
        Span span = tracer.spanBuilder("check-for-model-updates").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("modelFile", modelPath.toString());
            long currentModifiedTime = Files.getLastModifiedTime(modelPath).toMillis();
            if (currentModifiedTime > lastModifiedTime) {
                span.addEvent("Change detected. Triggering reload.");
                logger.info("Change detected in {}. Attempting to reload...", modelPath);
                loadModel();
            }
        } catch (IOException e) {
            span.recordException(e);
            logger.warn("Could not check model file {} for modifications", modelPath, e);
        } catch (RuntimeException e) {
            span.recordException(e);
            logger.error("Unexpected error during model reload check", e);
        } finally {
            span.end();
        }
    }

    private void loadModel() {
        try {
            reloadInternal();
        } catch (ModelLoadException | RuntimeException e) {
            logger.error("Failed to load new rule model from {}. Old model remains active.", modelPath, e);
        }
    }

    private synchronized void reloadInternal() throws ModelLoadException {
        Span span = tracer.spanBuilder("load-new-model").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long modifiedTime = modifiedTimeOrUnknown();
            RuleModel newModel = loader.load(modelPath);
            IEndpointResolver newResolver = resolverFactory.apply(newModel);
            warmup(newResolver);

            ActiveModel previous = active.getAndSet(new ActiveModel(newModel, newResolver));
            this.lastModifiedTime = modifiedTime;

            span.setAttribute("model.version", newModel.getVersion());
            span.setAttribute("model.nodes", newModel.getNodeCount());
            metrics.counter(RELOADS, "outcome", "success").increment();
            metrics.gauge(NODE_COUNT).set(newModel.getNodeCount());
            if (previous == null) {
                logger.info("Loaded rule model {} from {}", newModel.getVersion(), modelPath);
            } else {
                logger.info("Swapped rule model {} -> {} from {}",
                        previous.model().getVersion(), newModel.getVersion(), modelPath);
            }
        } catch (ModelLoadException | RuntimeException e) {
            metrics.counter(RELOADS, "outcome", "failure").increment();
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }

    private long modifiedTimeOrUnknown() {
        try {
            return Files.getLastModifiedTime(modelPath).toMillis();
        } catch (IOException e) {
            // The loader reports the missing file.
            return -1;
        }
    }

    private void warmup(IEndpointResolver resolver) {
        Consumer<IEndpointResolver> callback = warmupCallback;
        if (callback == null) {
            return;
        }
        Span warmupSpan = tracer.spanBuilder("resolver-warmup").startSpan();
        try (Scope warmupScope = warmupSpan.makeCurrent()) {
            long warmupStart = System.nanoTime();
            callback.accept(resolver);
            double warmupMs = (System.nanoTime() - warmupStart) / 1_000_000.0;
            warmupSpan.setAttribute("warmupDurationMs", warmupMs);
            logger.info("Resolver warmup completed in {} ms", String.format("%.2f", warmupMs));
        } catch (RuntimeException e) {
            warmupSpan.recordException(e);
            logger.warn("Resolver warmup failed, continuing with cold caches", e);
        } finally {
            warmupSpan.end();
        }
    }
}
