/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.runtime.functions.url;

import com.waypoint.endpoints.api.model.Value;
import com.waypoint.endpoints.runtime.diagnostics.DiagnosticsCollector;
import com.waypoint.endpoints.runtime.functions.Arguments;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * URL parsing, percent-encoding and host label validation.
 */
public final class UrlFunctions {

    public static final String PARSE_URL = "parseURL";
    public static final String URI_ENCODE = "uriEncode";
    public static final String IS_VALID_HOST_LABEL = "isValidHostLabel";

    private static final Pattern IPV4 = Pattern.compile("^(\\d{1,3}\\.){3}\\d{1,3}$");
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private UrlFunctions() {
    }

    /**
     * Accepts absolute http and https URLs without a query string.
     */
    public static Optional<Value> parseUrl(Value[] args, DiagnosticsCollector diagnostics) {
        Arguments.requireArity(PARSE_URL, args, 1);
        String raw = Arguments.string(PARSE_URL, args, 0);

        URI uri;
        try {
            uri = new URI(raw);
        } catch (URISyntaxException e) {
            diagnostics.reportError("parseURL: " + e.getMessage());
            return Optional.empty();
        }

        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            diagnostics.reportError("parseURL: unsupported scheme in '" + raw + "'");
            return Optional.empty();
        }
        if (uri.getRawQuery() != null) {
            diagnostics.reportError("parseURL: URL must not have a query string");
            return Optional.empty();
        }
        String authority = uri.getRawAuthority();
        if (authority == null || authority.isEmpty()) {
            diagnostics.reportError("parseURL: missing authority in '" + raw + "'");
            return Optional.empty();
        }

        String path = uri.getRawPath() == null ? "" : uri.getRawPath();
        String host = uri.getHost() == null ? authority : uri.getHost();
        boolean isIp = host.startsWith("[") || IPV4.matcher(host).matches();

        return Optional.of(new ParsedUrl(scheme.toLowerCase(), authority, path, normalizePath(path), isIp));
    }

    static String normalizePath(String path) {
        StringBuilder normalized = new StringBuilder(path.length() + 2);
        if (!path.startsWith("/")) {
            normalized.append('/');
        }
        normalized.append(path);
        if (normalized.charAt(normalized.length() - 1) != '/') {
            normalized.append('/');
        }
        return normalized.toString();
    }

    /**
     * Percent-encodes every byte of the UTF-8 form except RFC 3986 unreserved
     * characters.
     */
    public static Optional<Value> uriEncode(Value[] args, DiagnosticsCollector diagnostics) {
        Arguments.requireArity(URI_ENCODE, args, 1);
        return Optional.of(Value.of(percentEncode(Arguments.string(URI_ENCODE, args, 0))));
    }

    static String percentEncode(String input) {
        byte[] bytes = input.getBytes(StandardCharsets.UTF_8);
        StringBuilder out = new StringBuilder(bytes.length);
        for (byte b : bytes) {
            int c = b & 0xFF;
            if (isUnreserved(c)) {
                out.append((char) c);
            } else {
                out.append('%').append(HEX[c >> 4]).append(HEX[c & 0x0F]);
            }
        }
        return out.toString();
    }

    private static boolean isUnreserved(int c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')
                || c == '-' || c == '.' || c == '_' || c == '~';
    }

    public static Optional<Value> isValidHostLabel(Value[] args, DiagnosticsCollector diagnostics) {
        Arguments.requireArity(IS_VALID_HOST_LABEL, args, 2);
        String label = Arguments.string(IS_VALID_HOST_LABEL, args, 0);
        boolean allowSubDomains = Arguments.bool(IS_VALID_HOST_LABEL, args, 1);
        return Optional.of(Value.of(isValidHostLabel(label, allowSubDomains, diagnostics)));
    }

    /**
     * RFC 1123 label: 1 to 63 ASCII letters, digits or hyphens, not starting
     * with a hyphen. With {@code allowSubDomains}, every dot-separated label
     * must be valid.
     */
    public static boolean isValidHostLabel(String label, boolean allowSubDomains, DiagnosticsCollector diagnostics) {
        if (allowSubDomains) {
            for (String part : label.split("\\.", -1)) {
                if (!isValidHostLabel(part, false, diagnostics)) {
                    return false;
                }
            }
            return true;
        }
        if (label.isEmpty() || label.length() > 63) {
            diagnostics.reportError("host label must be 1 to 63 characters: '" + label + "'");
            return false;
        }
        if (label.charAt(0) == '-') {
            diagnostics.reportError("host label cannot start with '-': '" + label + "'");
            return false;
        }
        for (int i = 0; i < label.length(); i++) {
            char ch = label.charAt(i);
            boolean alphanumeric = (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || (ch >= '0' && ch <= '9');
            if (!alphanumeric && ch != '-') {
                diagnostics.reportError("host label must only contain alphanumeric characters or '-': '" + label + "'");
                return false;
            }
        }
        return true;
    }
}
