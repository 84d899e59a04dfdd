/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.api;

import com.waypoint.endpoints.api.model.EndpointParameters;
import com.waypoint.endpoints.api.model.ResolutionResult;
import com.waypoint.endpoints.api.model.Value;

import java.util.Map;

/**
 * Contract for resolving an endpoint from a compiled rule model.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * IEndpointResolver resolver = // obtain from EndpointResolverFactory
 *
 * ResolutionResult result = resolver.resolve(EndpointParameters.builder()
 *     .set("Region", "us-west-2")
 *     .set("UseFIPS", true)
 *     .build());
 *
 * if (result.isSuccess()) {
 *     URI uri = URI.create(result.endpoint().url());
 * } else {
 *     log.warn(result.failure().describe());
 * }
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations must be thread-safe. All per-call state (parameter values,
 * bound variables, memoized condition outcomes, diagnostics) is created fresh for
 * each call and discarded afterwards, so one resolver may serve any number of
 * concurrent callers.
 *
 * <h2>Determinism</h2>
 * <p>The same model, parameters and registered functions always produce the same
 * outcome.
 */
public interface IEndpointResolver {

    /**
     * Resolves an endpoint.
     *
     * <p>Parameter values the model does not declare are ignored. Rule-authored
     * errors, no-match and invalid parameters are returned as failures; a model
     * that misbehaves at runtime throws.
     *
     * @param parameters parameter values keyed by name (must not be null)
     * @return success with the endpoint, or failure with kind, message and trace
     * @throws com.waypoint.endpoints.api.exceptions.MalformedModelException if the
     *         model's structure is violated during the walk
     * @throws com.waypoint.endpoints.api.exceptions.FunctionNotFoundException if a
     *         condition names a function the registry does not know
     */
    ResolutionResult resolve(EndpointParameters parameters);

    default ResolutionResult resolve(Map<String, Value> parameters) {
        return resolve(EndpointParameters.of(parameters));
    }

    /**
     * Resolves an endpoint and attaches the diagnostic trace to successes as well
     * as failures.
     *
     * <p><b>Performance Note:</b> trace collection records every condition outcome
     * and is intended for debugging.
     */
    default ResolutionResult resolveWithTrace(EndpointParameters parameters) {
        return resolve(parameters);
    }
}
