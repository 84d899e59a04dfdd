/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.runtime.functions;

import com.waypoint.endpoints.api.exceptions.FunctionNotFoundException;
import com.waypoint.endpoints.api.model.ValueType;
import com.waypoint.endpoints.config.ResolverConfig;
import com.waypoint.endpoints.runtime.model.RuleModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Maps function ids to implementations.
 *
 * <p>Registration happens during setup. Once {@link #freeze()} is called the
 * registry is read-only and may be shared by any number of resolvers and
 * threads without locking. {@code EndpointResolver} freezes the registry it
 * is built with.
 *
 * <pre>{@code
 * FunctionRegistry registry = FunctionRegistry.standard(config);
 * registry.register("myorg.shard", (args, diagnostics) -> ..., false);
 * IEndpointResolver resolver = new EndpointResolver(model, registry, config, tracer);
 * }</pre>
 */
public final class FunctionRegistry {
    private static final Logger logger = LoggerFactory.getLogger(FunctionRegistry.class);

    private final Map<String, FunctionDefinition> functions = new HashMap<>();
    private volatile boolean frozen;

    /**
     * Creates an empty, unfrozen registry.
     */
    public FunctionRegistry() {
    }

    /**
     * @return an unfrozen registry holding the standard library, with partition
     *         data taken from {@code config}
     */
    public static FunctionRegistry standard(ResolverConfig config) {
        FunctionRegistry registry = new FunctionRegistry();
        StandardLibrary.registerAll(registry, config);
        return registry;
    }

    public static FunctionRegistry standard() {
        return standard(ResolverConfig.defaults());
    }

    public FunctionRegistry register(String id, EndpointFunction function, boolean needsExtraState) {
        return register(new FunctionDefinition(id, function, needsExtraState, false, ValueType.ANY));
    }

    /**
     * Registers or replaces a function.
     *
     * @throws IllegalStateException if the registry is frozen
     */
    public synchronized FunctionRegistry register(FunctionDefinition definition) {
        if (frozen) {
            throw new IllegalStateException("Function registry is frozen; cannot register '" + definition.id() + "'");
        }
        FunctionDefinition previous = functions.put(definition.id(), definition);
        if (previous != null) {
            logger.debug("Replaced function '{}'", definition.id());
        }
        return this;
    }

    /**
     * @throws FunctionNotFoundException if nothing is registered under {@code id}
     */
    public FunctionDefinition lookup(String id) {
        FunctionDefinition definition = functions.get(id);
        if (definition == null) {
            throw new FunctionNotFoundException(id);
        }
        return definition;
    }

    public boolean contains(String id) {
        return functions.containsKey(id);
    }

    /**
     * @return the registered return type, or {@link ValueType#ANY} for unknown ids
     */
    public ValueType returnType(String id) {
        FunctionDefinition definition = functions.get(id);
        return definition == null ? ValueType.ANY : definition.returnType();
    }

    /**
     * @return every function id the model references, including nested calls
     */
    public SortedSet<String> usedFunctions(RuleModel model) {
        return new TreeSet<>(model.referencedFunctions());
    }

    /**
     * @return definitions of used functions that need extra state
     * @throws FunctionNotFoundException if a used function is not registered
     */
    public List<FunctionDefinition> statefulFunctions(RuleModel model) {
        List<FunctionDefinition> stateful = new ArrayList<>();
        for (String id : usedFunctions(model)) {
            FunctionDefinition definition = lookup(id);
            if (definition.needsExtraState()) {
                stateful.add(definition);
            }
        }
        return stateful;
    }

    /**
     * Verifies every function the model uses is registered and initializes the
     * state of the used stateful functions. Unused stateful functions are left
     * untouched.
     *
     * @throws FunctionNotFoundException if a used function is not registered
     */
    public void prepare(RuleModel model) {
        for (FunctionDefinition definition : statefulFunctions(model)) {
            StatefulFunction function = (StatefulFunction) definition.function();
            if (!function.isInitialized()) {
                long start = System.nanoTime();
                function.initialize();
                logger.info("Initialized state for '{}' in {} ms", definition.id(), (System.nanoTime() - start) / 1_000_000);
            }
        }
    }

    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public int size() {
        return functions.size();
    }
}
