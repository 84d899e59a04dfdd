/*
 * Copyright (c) 2025 Waypoint Endpoint Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.waypoint.endpoints.runtime.model;

/**
 * Encoding of references between decision nodes and terminals.
 *
 * <pre>
 *   ref &gt;= 0   -&gt; node index
 *   ref == -1  -&gt; no rule matched
 *   ref &lt;= -2  -&gt; result index (-ref - 2), i.e. result k is encoded as -(k + 2)
 * </pre>
 */
public final class NodeRef {

    public static final int NO_MATCH = -1;

    private NodeRef() {
        throw new AssertionError("No instances");
    }

    public static boolean isNode(int ref) {
        return ref >= 0;
    }

    public static boolean isTerminal(int ref) {
        return ref < 0;
    }

    public static boolean isNoMatch(int ref) {
        return ref == NO_MATCH;
    }

    public static boolean isResult(int ref) {
        return ref <= -2;
    }

    public static int forResult(int resultIndex) {
        if (resultIndex < 0) {
            throw new IllegalArgumentException("Result index must be non-negative: " + resultIndex);
        }
        return -(resultIndex + 2);
    }

    public static int resultIndex(int ref) {
        if (!isResult(ref)) {
            throw new IllegalArgumentException("Not a result reference: " + ref);
        }
        return -ref - 2;
    }

    public static String describe(int ref) {
        if (isNode(ref)) return "node " + ref;
        if (isNoMatch(ref)) return "no-match";
        return "result " + resultIndex(ref);
    }
}
