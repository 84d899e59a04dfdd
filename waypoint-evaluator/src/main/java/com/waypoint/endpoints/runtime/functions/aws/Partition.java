/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.runtime.functions.aws;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.waypoint.endpoints.api.model.StructuredValue;
import com.waypoint.endpoints.api.model.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Partition descriptor returned by {@code aws.partition}. Doubles as the JSON
 * shape of a partition's {@code outputs} block.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Partition(
        @JsonProperty("name") String name,
        @JsonProperty("dnsSuffix") String dnsSuffix,
        @JsonProperty("dualStackDnsSuffix") String dualStackDnsSuffix,
        @JsonProperty("supportsFIPS") boolean supportsFIPS,
        @JsonProperty("supportsDualStack") boolean supportsDualStack,
        @JsonProperty("implicitGlobalRegion") String implicitGlobalRegion
) implements StructuredValue {

    /**
     * Applies a region's overrides to this partition's outputs.
     */
    Partition withOverrides(RegionOverride override) {
        if (override == null) {
            return this;
        }
        return new Partition(
                name,
                override.dnsSuffix() != null ? override.dnsSuffix() : dnsSuffix,
                override.dualStackDnsSuffix() != null ? override.dualStackDnsSuffix() : dualStackDnsSuffix,
                override.supportsFIPS() != null ? override.supportsFIPS() : supportsFIPS,
                override.supportsDualStack() != null ? override.supportsDualStack() : supportsDualStack,
                implicitGlobalRegion);
    }

    @Override
    public Map<String, Value> attributes() {
        Map<String, Value> attributes = new LinkedHashMap<>();
        putIfPresent(attributes, "name", name);
        putIfPresent(attributes, "dnsSuffix", dnsSuffix);
        putIfPresent(attributes, "dualStackDnsSuffix", dualStackDnsSuffix);
        attributes.put("supportsFIPS", Value.of(supportsFIPS));
        attributes.put("supportsDualStack", Value.of(supportsDualStack));
        putIfPresent(attributes, "implicitGlobalRegion", implicitGlobalRegion);
        return attributes;
    }

    private static void putIfPresent(Map<String, Value> attributes, String name, String value) {
        if (value != null) {
            attributes.put(name, Value.of(value));
        }
    }

    @Override
    public String render() {
        return name;
    }

    /**
     * Per-region overrides inside a partition's {@code regions} map. All fields optional.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RegionOverride(
            @JsonProperty("description") String description,
            @JsonProperty("dnsSuffix") String dnsSuffix,
            @JsonProperty("dualStackDnsSuffix") String dualStackDnsSuffix,
            @JsonProperty("supportsFIPS") Boolean supportsFIPS,
            @JsonProperty("supportsDualStack") Boolean supportsDualStack
    ) {
    }
}
