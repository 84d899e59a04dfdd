/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.api;

import com.waypoint.endpoints.api.exceptions.ModelLoadException;
import com.waypoint.endpoints.runtime.model.RuleModel;
import io.opentelemetry.api.trace.Tracer;

import java.io.InputStream;
import java.nio.file.Path;

/**
 * Contract for loading a serialized decision-diagram rule set into a validated
 * {@link RuleModel}.
 */
public interface IRuleModelLoader {

    /**
     * Loads a rule model from a JSON file.
     *
     * @param modelPath path to the JSON model
     * @return validated model
     * @throws ModelLoadException if the file cannot be read, parsed or validated
     */
    RuleModel load(Path modelPath) throws ModelLoadException;

    /**
     * Loads a rule model from a stream. The stream is not closed.
     */
    RuleModel load(InputStream json) throws ModelLoadException;

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }

    /**
     * Sets a listener notified as each load stage starts and finishes.
     *
     * @param listener the listener (null to disable)
     */
    default void setLoadListener(ModelLoadListener listener) {
    }
}
