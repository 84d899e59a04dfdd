/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.runtime.functions.aws;

import com.waypoint.endpoints.api.model.StructuredValue;
import com.waypoint.endpoints.api.model.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of {@code aws.parseArn}. {@code resourceId} holds the resource part
 * split on {@code :} and {@code /}.
 */
public record Arn(
        String partition,
        String service,
        String region,
        String accountId,
        List<String> resourceId
) implements StructuredValue {

    public Arn {
        resourceId = List.copyOf(resourceId);
    }

    @Override
    public Map<String, Value> attributes() {
        Map<String, Value> attributes = new LinkedHashMap<>();
        attributes.put("partition", Value.of(partition));
        attributes.put("service", Value.of(service));
        attributes.put("region", Value.of(region));
        attributes.put("accountId", Value.of(accountId));
        attributes.put("resourceId", Value.ofStrings(resourceId));
        return attributes;
    }

    @Override
    public String render() {
        return "arn:" + partition + ":" + service + ":" + region + ":" + accountId + ":" + String.join(":", resourceId);
    }
}
