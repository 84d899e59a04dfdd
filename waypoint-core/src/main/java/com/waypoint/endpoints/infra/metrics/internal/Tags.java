/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.infra.metrics.internal;

/**
 * Helpers for the alternating key/value tag arrays taken by
 * {@link com.waypoint.endpoints.infra.metrics.MetricsRegistry}.
 *
 * <p><b>INTERNAL USE ONLY</b> - API may change without notice.
 */
public final class Tags {

    private Tags() {
        throw new AssertionError("No instances");
    }

    /**
     * Identity of a meter: {@code name} alone, or {@code name{k=v,...}}.
     *
     * @throws IllegalArgumentException if {@code tags} has odd length
     */
    public static String meterKey(String name, String... tags) {
        requireEven(tags);
        if (tags.length == 0) {
            return name;
        }
        StringBuilder key = new StringBuilder(name).append('{');
        for (int i = 0; i < tags.length; i += 2) {
            if (i > 0) {
                key.append(',');
            }
            key.append(tags[i]).append('=').append(tags[i + 1]);
        }
        return key.append('}').toString();
    }

    public static String[] names(String... tags) {
        requireEven(tags);
        String[] names = new String[tags.length / 2];
        for (int i = 0; i < names.length; i++) {
            names[i] = tags[i * 2];
        }
        return names;
    }

    public static String[] values(String... tags) {
        requireEven(tags);
        String[] values = new String[tags.length / 2];
        for (int i = 0; i < values.length; i++) {
            values[i] = tags[i * 2 + 1];
        }
        return values;
    }

    private static void requireEven(String[] tags) {
        if (tags.length % 2 != 0) {
            throw new IllegalArgumentException("Tags must be key/value pairs, got " + tags.length + " elements");
        }
    }
}
