/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.runtime.functions.aws;

import com.waypoint.endpoints.api.model.Value;
import com.waypoint.endpoints.runtime.diagnostics.DiagnosticsCollector;
import com.waypoint.endpoints.runtime.functions.Arguments;
import com.waypoint.endpoints.runtime.functions.url.UrlFunctions;

import java.util.Arrays;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * ARN parsing and S3 bucket-name checks.
 */
public final class AwsFunctions {

    public static final String PARSE_ARN = "aws.parseArn";
    public static final String IS_VIRTUAL_HOSTABLE_S3_BUCKET = "aws.isVirtualHostableS3Bucket";

    private static final Pattern VIRTUAL_HOSTABLE_NAME = Pattern.compile("^[a-z\\d][a-z\\d\\-.]{1,61}[a-z\\d]$");
    private static final Pattern IPV4 = Pattern.compile("^(\\d+\\.){3}\\d+$");
    private static final Pattern DOTS_AND_DASHES = Pattern.compile("^.*((\\.-)|(-\\.)).*$");
    private static final Pattern RESOURCE_DELIMITER = Pattern.compile("[:/]");

    private AwsFunctions() {
    }

    /**
     * {@code arn:partition:service:region:account-id:resource}. Region and account
     * may be empty; partition, service and resource may not.
     */
    public static Optional<Value> parseArn(Value[] args, DiagnosticsCollector diagnostics) {
        Arguments.requireArity(PARSE_ARN, args, 1);
        String raw = Arguments.string(PARSE_ARN, args, 0);

        String[] parts = raw.split(":", 6);
        if (parts.length < 6) {
            diagnostics.reportError("ARN must have at least 6 segments: '" + raw + "'");
            return Optional.empty();
        }
        if (!"arn".equals(parts[0])) {
            diagnostics.reportError("ARN must start with 'arn': '" + raw + "'");
            return Optional.empty();
        }
        if (parts[1].isEmpty()) {
            diagnostics.reportError("ARN partition must not be empty");
            return Optional.empty();
        }
        if (parts[2].isEmpty()) {
            diagnostics.reportError("ARN service must not be empty");
            return Optional.empty();
        }
        if (parts[5].isEmpty()) {
            diagnostics.reportError("ARN resource must not be empty");
            return Optional.empty();
        }
        return Optional.of(new Arn(parts[1], parts[2], parts[3], parts[4],
                Arrays.asList(RESOURCE_DELIMITER.split(parts[5], -1))));
    }

    public static Optional<Value> isVirtualHostableS3Bucket(Value[] args, DiagnosticsCollector diagnostics) {
        Arguments.requireArity(IS_VIRTUAL_HOSTABLE_S3_BUCKET, args, 2);
        String bucket = Arguments.string(IS_VIRTUAL_HOSTABLE_S3_BUCKET, args, 0);
        boolean allowSubDomains = Arguments.bool(IS_VIRTUAL_HOSTABLE_S3_BUCKET, args, 1);
        return Optional.of(Value.of(isVirtualHostableS3Bucket(bucket, allowSubDomains, diagnostics)));
    }

    /**
     * Lowercase DNS-compatible name of 3 to 63 characters that is not an IPv4
     * address. Dots are only allowed with {@code allowSubDomains}.
     */
    static boolean isVirtualHostableS3Bucket(String bucket, boolean allowSubDomains, DiagnosticsCollector diagnostics) {
        if (!UrlFunctions.isValidHostLabel(bucket, allowSubDomains, diagnostics)) {
            return false;
        }
        return isVirtualHostableName(bucket);
    }

    private static boolean isVirtualHostableName(String label) {
        return VIRTUAL_HOSTABLE_NAME.matcher(label).matches()
                && !IPV4.matcher(label).matches()
                && !DOTS_AND_DASHES.matcher(label).matches();
    }
}
