/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.runtime.functions.aws;

import com.waypoint.endpoints.api.model.Value;
import com.waypoint.endpoints.runtime.diagnostics.DiagnosticsCollector;
import com.waypoint.endpoints.runtime.functions.Arguments;
import com.waypoint.endpoints.runtime.functions.StatefulFunction;

import java.nio.file.Path;
import java.util.Optional;

/**
 * {@code aws.partition(region)}. The partition table is loaded on
 * {@link #initialize()}, so models that never call this function never read it.
 */
public final class PartitionFunction implements StatefulFunction {

    public static final String ID = "aws.partition";

    private final String partitionsPath;
    private final long cacheSize;
    private volatile PartitionResolver resolver;

    /**
     * @param partitionsPath file system path of the partition table, or null for the bundled table
     */
    public PartitionFunction(String partitionsPath, long cacheSize) {
        this.partitionsPath = partitionsPath;
        this.cacheSize = cacheSize;
    }

    public PartitionFunction(PartitionResolver resolver) {
        this.partitionsPath = null;
        this.cacheSize = 0;
        this.resolver = resolver;
    }

    @Override
    public synchronized void initialize() {
        if (resolver != null) {
            return;
        }
        resolver = partitionsPath == null
                ? PartitionResolver.loadBundled(cacheSize)
                : PartitionResolver.load(Path.of(partitionsPath), cacheSize);
    }

    @Override
    public boolean isInitialized() {
        return resolver != null;
    }

    @Override
    public Optional<Value> apply(Value[] args, DiagnosticsCollector diagnostics) {
        Arguments.requireArity(ID, args, 1);
        PartitionResolver current = resolver;
        if (current == null) {
            throw new IllegalStateException(ID + " used before its partition table was initialized");
        }
        return Optional.of(current.resolve(Arguments.string(ID, args, 0)));
    }
}
