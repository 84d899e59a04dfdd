/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.runtime.functions;

import com.waypoint.endpoints.api.model.ValueType;
import com.waypoint.endpoints.config.ResolverConfig;
import com.waypoint.endpoints.runtime.functions.aws.AwsFunctions;
import com.waypoint.endpoints.runtime.functions.aws.PartitionFunction;
import com.waypoint.endpoints.runtime.functions.url.UrlFunctions;

/**
 * Registers the built-in endpoint functions.
 *
 * <table>
 *   <tr><th>id</th><th>absent args</th><th>returns</th></tr>
 *   <tr><td>isSet, booleanEquals, stringEquals</td><td>accepted</td><td>BOOLEAN</td></tr>
 *   <tr><td>not, isValidHostLabel, aws.isVirtualHostableS3Bucket</td><td>short-circuit</td><td>BOOLEAN</td></tr>
 *   <tr><td>substring, uriEncode</td><td>short-circuit</td><td>STRING</td></tr>
 *   <tr><td>split</td><td>short-circuit</td><td>ARRAY</td></tr>
 *   <tr><td>getAttr</td><td>short-circuit</td><td>ANY</td></tr>
 *   <tr><td>parseURL, aws.partition, aws.parseArn</td><td>short-circuit</td><td>RECORD</td></tr>
 * </table>
 */
public final class StandardLibrary {

    private StandardLibrary() {
    }

    public static void registerAll(FunctionRegistry registry, ResolverConfig config) {
        registry.register(FunctionDefinition.absentTolerant(CoreFunctions.IS_SET, CoreFunctions::isSet, ValueType.BOOLEAN));
        registry.register(FunctionDefinition.absentTolerant(CoreFunctions.BOOLEAN_EQUALS, CoreFunctions::booleanEquals, ValueType.BOOLEAN));
        registry.register(FunctionDefinition.absentTolerant(CoreFunctions.STRING_EQUALS, CoreFunctions::stringEquals, ValueType.BOOLEAN));
        registry.register(FunctionDefinition.of(CoreFunctions.NOT, CoreFunctions::not, ValueType.BOOLEAN));
        registry.register(FunctionDefinition.of(CoreFunctions.GET_ATTR, CoreFunctions::getAttr, ValueType.ANY));
        registry.register(FunctionDefinition.of(CoreFunctions.SUBSTRING, CoreFunctions::substring, ValueType.STRING));
        registry.register(FunctionDefinition.of(CoreFunctions.SPLIT, CoreFunctions::split, ValueType.ARRAY));

        registry.register(FunctionDefinition.of(UrlFunctions.URI_ENCODE, UrlFunctions::uriEncode, ValueType.STRING));
        registry.register(FunctionDefinition.of(UrlFunctions.PARSE_URL, UrlFunctions::parseUrl, ValueType.RECORD));
        registry.register(FunctionDefinition.of(UrlFunctions.IS_VALID_HOST_LABEL, UrlFunctions::isValidHostLabel, ValueType.BOOLEAN));

        registry.register(new FunctionDefinition(PartitionFunction.ID,
                new PartitionFunction(config.getPartitionsPath(), config.getPartitionCacheSize()),
                true, false, ValueType.RECORD));
        registry.register(FunctionDefinition.of(AwsFunctions.PARSE_ARN, AwsFunctions::parseArn, ValueType.RECORD));
        registry.register(FunctionDefinition.of(AwsFunctions.IS_VIRTUAL_HOSTABLE_S3_BUCKET,
                AwsFunctions::isVirtualHostableS3Bucket, ValueType.BOOLEAN));
    }
}
