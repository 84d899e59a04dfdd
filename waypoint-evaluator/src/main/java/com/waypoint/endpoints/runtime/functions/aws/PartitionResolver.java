/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.runtime.functions.aws;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Maps region names to partitions using a {@code partitions.json} table.
 *
 * <p>Matching order: a partition that lists the region explicitly, then the
 * first partition whose {@code regionRegex} matches, then the {@code aws}
 * partition. Resolutions are cached in a bounded Caffeine cache; the table
 * itself is immutable once loaded.
 */
public final class PartitionResolver {
    private static final Logger logger = LoggerFactory.getLogger(PartitionResolver.class);

    public static final String BUNDLED_RESOURCE = "partitions.json";
    public static final String DEFAULT_PARTITION = "aws";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final List<CompiledPartition> partitions;
    private final CompiledPartition fallback;
    private final Cache<String, Partition> cache;

    private PartitionResolver(PartitionTable table, long cacheSize) {
        if (table.partitions() == null || table.partitions().isEmpty()) {
            throw new IllegalArgumentException("Partition table contains no partitions");
        }
        List<CompiledPartition> compiled = new ArrayList<>();
        CompiledPartition defaultPartition = null;
        for (PartitionEntry entry : table.partitions()) {
            if (entry.id() == null || entry.outputs() == null) {
                throw new IllegalArgumentException("Partition entries require 'id' and 'outputs'");
            }
            CompiledPartition partition = new CompiledPartition(entry, compile(entry));
            compiled.add(partition);
            if (DEFAULT_PARTITION.equals(entry.id())) {
                defaultPartition = partition;
            }
        }
        this.partitions = List.copyOf(compiled);
        this.fallback = defaultPartition != null ? defaultPartition : compiled.get(0);
        this.cache = Caffeine.newBuilder()
                .maximumSize(cacheSize)
                .recordStats()
                .build();
        logger.info("Loaded {} partitions (version {}), default '{}'",
                partitions.size(), table.version(), fallback.entry.id());
    }

    private static Pattern compile(PartitionEntry entry) {
        if (entry.regionRegex() == null) {
            return null;
        }
        try {
            return Pattern.compile(entry.regionRegex());
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid regionRegex for partition '" + entry.id() + "'", e);
        }
    }

    /**
     * Loads the table bundled on the classpath.
     */
    public static PartitionResolver loadBundled(long cacheSize) {
        try (InputStream in = PartitionResolver.class.getClassLoader().getResourceAsStream(BUNDLED_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Bundled " + BUNDLED_RESOURCE + " not found on classpath");
            }
            return load(in, cacheSize);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read bundled " + BUNDLED_RESOURCE, e);
        }
    }

    public static PartitionResolver load(Path path, long cacheSize) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, cacheSize);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read partition table " + path, e);
        }
    }

    public static PartitionResolver load(InputStream json, long cacheSize) throws IOException {
        return new PartitionResolver(MAPPER.readValue(json, PartitionTable.class), cacheSize);
    }

    /**
     * @return the partition for {@code region}; never null
     */
    public Partition resolve(String region) {
        return cache.get(region, this::match);
    }

    private Partition match(String region) {
        for (CompiledPartition partition : partitions) {
            Map<String, Partition.RegionOverride> regions = partition.entry.regions();
            if (regions != null && regions.containsKey(region)) {
                return partition.entry.outputs().withOverrides(regions.get(region));
            }
        }
        for (CompiledPartition partition : partitions) {
            if (partition.regionRegex != null && partition.regionRegex.matcher(region).matches()) {
                return partition.entry.outputs();
            }
        }
        logger.debug("Region '{}' matched no partition, using '{}'", region, fallback.entry.id());
        return fallback.entry.outputs();
    }

    public int partitionCount() {
        return partitions.size();
    }

    public long cacheSize() {
        return cache.estimatedSize();
    }

    private static final class CompiledPartition {
        final PartitionEntry entry;
        final Pattern regionRegex;

        CompiledPartition(PartitionEntry entry, Pattern regionRegex) {
            this.entry = entry;
            this.regionRegex = regionRegex;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PartitionTable(
            @JsonProperty("version") String version,
            @JsonProperty("partitions") List<PartitionEntry> partitions
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PartitionEntry(
            @JsonProperty("id") String id,
            @JsonProperty("regionRegex") String regionRegex,
            @JsonProperty("regions") Map<String, Partition.RegionOverride> regions,
            @JsonProperty("outputs") Partition outputs
    ) {
    }
}
