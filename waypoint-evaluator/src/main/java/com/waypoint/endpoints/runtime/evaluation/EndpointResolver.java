/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.runtime.evaluation;

import com.waypoint.endpoints.api.IEndpointResolver;
import com.waypoint.endpoints.api.exceptions.RuleModelException;
import com.waypoint.endpoints.api.model.EndpointParameters;
import com.waypoint.endpoints.api.model.ResolutionFailure;
import com.waypoint.endpoints.api.model.ResolutionResult;
import com.waypoint.endpoints.api.model.Value;
import com.waypoint.endpoints.config.ResolverConfig;
import com.waypoint.endpoints.runtime.context.EvaluationContext;
import com.waypoint.endpoints.runtime.diagnostics.DiagnosticsCollector;
import com.waypoint.endpoints.runtime.functions.FunctionRegistry;
import com.waypoint.endpoints.runtime.model.Parameter;
import com.waypoint.endpoints.runtime.model.RuleModel;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves endpoints by walking a compiled {@link RuleModel}.
 *
 * <h2>Architecture</h2>
 * <ol>
 * <li>Bind parameters: supplied value, else default; required and type checks</li>
 * <li>Walk the decision diagram ({@link DecisionWalker}), evaluating each
 * condition at most once ({@link ConditionEvaluator})</li>
 * <li>Render the reached terminal ({@link ResultResolver})</li>
 * </ol>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * The model and the (frozen) registry are shared read-only. Every call allocates
 * its own {@link EvaluationContext} and {@link DiagnosticsCollector}, so
 * concurrent calls on one instance need no synchronization.
 */
public final class EndpointResolver implements IEndpointResolver {
    private static final Logger logger = LoggerFactory.getLogger(EndpointResolver.class);

    // ════════════════════════════════════════════════════════════════════════════════
    // INSTANCE FIELDS
    // ════════════════════════════════════════════════════════════════════════════════

    private final RuleModel model;
    private final FunctionRegistry registry;
    private final ResolverConfig config;
    private final Tracer tracer;
    private final ResolverMetrics metrics;

    private final DecisionWalker walker;
    private final ResultResolver resultResolver;

    // ════════════════════════════════════════════════════════════════════════════════
    // CONSTRUCTORS
    // ════════════════════════════════════════════════════════════════════════════════

    /**
     * Creates a resolver, verifying that every function the model uses is
     * registered and initializing the state of those that need it. The registry
     * is frozen.
     *
     * @throws com.waypoint.endpoints.api.exceptions.FunctionNotFoundException if the
     *         model uses an unregistered function
     */
    public EndpointResolver(RuleModel model, FunctionRegistry registry, ResolverConfig config, Tracer tracer) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.metrics = new ResolverMetrics();

        registry.prepare(model);
        registry.freeze();

        ExpressionEvaluator expressions = new ExpressionEvaluator(model, registry);
        ConditionEvaluator conditions = new ConditionEvaluator(model, registry, expressions);
        this.walker = new DecisionWalker(model, conditions, config.effectiveStepBudget(model.getNodeCount()));
        this.resultResolver = new ResultResolver(model, expressions);

        logger.info("EndpointResolver initialized: {} ({} functions used, step budget {})",
                model, registry.usedFunctions(model).size(), walker.getStepBudget());
    }

    public EndpointResolver(RuleModel model, FunctionRegistry registry) {
        this(model, registry, ResolverConfig.defaults(), OpenTelemetry.noop().getTracer("waypoint-evaluator"));
    }

    /**
     * Creates a resolver with the standard function library and default configuration.
     */
    public EndpointResolver(RuleModel model) {
        this(model, FunctionRegistry.standard());
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // IEndpointResolver INTERFACE IMPLEMENTATION
    // ════════════════════════════════════════════════════════════════════════════════

    @Override
    public ResolutionResult resolve(EndpointParameters parameters) {
        return doResolve(parameters, config.isTraceOnSuccess());
    }

    @Override
    public ResolutionResult resolveWithTrace(EndpointParameters parameters) {
        return doResolve(parameters, true);
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // CORE RESOLUTION LOGIC
    // ════════════════════════════════════════════════════════════════════════════════

    private ResolutionResult doResolve(EndpointParameters parameters, boolean attachTrace) {
        Objects.requireNonNull(parameters, "parameters must not be null");

        Span span = tracer.spanBuilder("resolve-endpoint").startSpan();
        long start = System.nanoTime();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("model.version", model.getVersion());

            EvaluationContext ctx = new EvaluationContext(model);
            String invalid = bindParameters(ctx, parameters);
            if (invalid != null) {
                ResolutionFailure failure = ResolutionFailure.invalidParameters(invalid);
                metrics.recordFailure(failure.kind(), System.nanoTime() - start, 0);
                span.setAttribute("outcome", failure.kind().name());
                return ResolutionResult.failure(failure);
            }

            DiagnosticsCollector diagnostics = new DiagnosticsCollector();
            int terminal = walker.walk(ctx, diagnostics);
            ResolutionResult result = resultResolver.render(terminal, ctx, diagnostics, attachTrace);

            long elapsed = System.nanoTime() - start;
            if (result.isSuccess()) {
                metrics.recordSuccess(elapsed, ctx.getConditionsEvaluated());
                span.setAttribute("outcome", "SUCCESS");
            } else {
                metrics.recordFailure(result.failure().kind(), elapsed, ctx.getConditionsEvaluated());
                span.setAttribute("outcome", result.failure().kind().name());
            }
            span.setAttribute("conditionsEvaluated", ctx.getConditionsEvaluated());
            return result;
        } catch (RuleModelException e) {
            metrics.recordModelError(System.nanoTime() - start);
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            logger.error("Endpoint resolution failed for model {}: {}", model.getVersion(), e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Fills parameter slots: supplied value, else default, else absent.
     *
     * @return a message describing the first invalid parameter, or null
     */
    private String bindParameters(EvaluationContext ctx, EndpointParameters parameters) {
        Map<String, Value> supplied = parameters.asMap();
        for (int slot = 0; slot < model.getParameterCount(); slot++) {
            Parameter parameter = model.getParameter(slot);
            Value value = supplied.get(parameter.name());
            if (value == null) {
                value = parameter.defaultValue();
            }
            if (value == null) {
                if (parameter.required()) {
                    return "Missing required parameter '" + parameter.name() + "'";
                }
                continue;
            }
            if (!parameter.type().matches(value)) {
                return String.format("Parameter '%s' expects %s but got %s",
                        parameter.name(), parameter.type().getSerializedName(), value.type());
            }
            ctx.setParameter(slot, value);
        }

        if (logger.isDebugEnabled()) {
            for (String name : supplied.keySet()) {
                if (model.parameterSlot(name) < 0) {
                    logger.debug("Ignoring unknown parameter '{}'", name);
                }
            }
        }
        return null;
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // ACCESSORS
    // ════════════════════════════════════════════════════════════════════════════════

    public RuleModel getModel() {
        return model;
    }

    public FunctionRegistry getRegistry() {
        return registry;
    }

    public ResolverMetrics getMetrics() {
        return metrics;
    }

    public Map<String, Object> getDetailedMetrics() {
        Map<String, Object> all = new LinkedHashMap<>(metrics.getSnapshot());
        all.put("modelVersion", model.getVersion());
        all.put("nodeCount", model.getNodeCount());
        all.put("conditionCount", model.getConditionCount());
        all.put("resultCount", model.getResultCount());
        return all;
    }
}
