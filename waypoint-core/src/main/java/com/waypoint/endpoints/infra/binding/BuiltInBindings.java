/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.infra.binding;

import com.waypoint.endpoints.api.model.EndpointParameters;
import com.waypoint.endpoints.api.model.Value;
import com.waypoint.endpoints.runtime.model.Parameter;
import com.waypoint.endpoints.runtime.model.RuleModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Client-level values for built-in parameters.
 *
 * <p>A model parameter declaring {@code "builtIn": "AWS::Region"} is filled from
 * the client's region unless the caller passes that parameter explicitly:
 * <pre>{@code
 * BuiltInBindings client = BuiltInBindings.builder()
 *     .set(BuiltInBindings.REGION, Value.of("eu-west-1"))
 *     .build();
 * ResolutionResult result = resolver.resolve(client.bind(model, perCallParameters));
 * }</pre>
 */
public final class BuiltInBindings {
    private static final Logger logger = LoggerFactory.getLogger(BuiltInBindings.class);

    public static final String REGION = "AWS::Region";
    public static final String USE_FIPS = "AWS::UseFIPS";
    public static final String USE_DUAL_STACK = "AWS::UseDualStack";
    public static final String ENDPOINT = "SDK::Endpoint";
    public static final String ACCOUNT_ID = "AWS::Auth::AccountId";
    public static final String ACCOUNT_ID_ENDPOINT_MODE = "AWS::Auth::AccountIdEndpointMode";

    private static final BuiltInBindings EMPTY = new BuiltInBindings(Map.of());

    private final Map<String, Value> values;

    private BuiltInBindings(Map<String, Value> values) {
        this.values = values;
    }

    public static BuiltInBindings empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the standard {@code AWS_*} environment variables. Boolean variables
     * accept {@code true}/{@code false} in any case; other values are ignored
     * with a warning.
     */
    public static BuiltInBindings fromEnvironment(Function<String, String> env) {
        Builder builder = new Builder();
        builder.text(REGION, env.apply("AWS_REGION"));
        builder.flag(USE_FIPS, "AWS_USE_FIPS_ENDPOINT", env.apply("AWS_USE_FIPS_ENDPOINT"));
        builder.flag(USE_DUAL_STACK, "AWS_USE_DUALSTACK_ENDPOINT", env.apply("AWS_USE_DUALSTACK_ENDPOINT"));
        builder.text(ENDPOINT, env.apply("AWS_ENDPOINT_URL"));
        builder.text(ACCOUNT_ID, env.apply("AWS_ACCOUNT_ID"));
        builder.text(ACCOUNT_ID_ENDPOINT_MODE, env.apply("AWS_ACCOUNT_ID_ENDPOINT_MODE"));
        return builder.build();
    }

    public static BuiltInBindings fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /**
     * Adds built-in values for the model's built-in parameters that
     * {@code explicit} does not set. Explicit values always win.
     */
    public EndpointParameters bind(RuleModel model, EndpointParameters explicit) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(explicit, "explicit parameters must not be null");
        if (values.isEmpty()) {
            return explicit;
        }

        EndpointParameters.Builder bound = EndpointParameters.builder();
        int added = 0;
        for (Parameter parameter : model.getParameters()) {
            String builtIn = parameter.builtIn();
            if (builtIn == null || explicit.get(parameter.name()) != null) {
                continue;
            }
            Value value = values.get(builtIn);
            if (value != null) {
                bound.set(parameter.name(), value);
                added++;
            }
        }
        if (added == 0) {
            return explicit;
        }
        logger.debug("Bound {} built-in parameter(s) for model {}", added, model.getVersion());
        return bound.setAll(explicit.asMap()).build();
    }

    public Value get(String builtIn) {
        return values.get(builtIn);
    }

    public Map<String, Value> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "BuiltInBindings" + values;
    }

    public static final class Builder {
        private final Map<String, Value> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder set(String builtIn, Value value) {
            values.put(Objects.requireNonNull(builtIn, "builtIn must not be null"),
                    Objects.requireNonNull(value, "value must not be null"));
            return this;
        }

        public Builder region(String region) {
            return set(REGION, Value.of(region));
        }

        public Builder useFips(boolean useFips) {
            return set(USE_FIPS, Value.of(useFips));
        }

        public Builder useDualStack(boolean useDualStack) {
            return set(USE_DUAL_STACK, Value.of(useDualStack));
        }

        public Builder endpoint(String endpoint) {
            return set(ENDPOINT, Value.of(endpoint));
        }

        private void text(String builtIn, String raw) {
            if (raw != null && !raw.isBlank()) {
                set(builtIn, Value.of(raw.trim()));
            }
        }

        private void flag(String builtIn, String variable, String raw) {
            if (raw == null || raw.isBlank()) {
                return;
            }
            String trimmed = raw.trim();
            if (trimmed.equalsIgnoreCase("true") || trimmed.equalsIgnoreCase("false")) {
                set(builtIn, Value.of(Boolean.parseBoolean(trimmed)));
            } else {
                logger.warn("Ignoring {}: expected true or false, got '{}'", variable, raw);
            }
        }

        public BuiltInBindings build() {
            return values.isEmpty() ? EMPTY : new BuiltInBindings(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
        }
    }
}
