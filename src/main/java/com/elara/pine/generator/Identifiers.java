package com.elara.pine.generator;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Rewrites source names that would reach JavaScript's prototype, constructor or eval machinery.
 * Applied to every emitted variable, parameter, loop binder and property name.
 */
public final class Identifiers {
    public static final String SAFE_PREFIX = "_pine_";

    static final Set<String> DANGEROUS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "__proto__", "constructor", "prototype",
            "__defineGetter__", "__defineSetter__", "__lookupGetter__", "__lookupSetter__",
            "eval", "Function", "arguments", "caller", "callee")));

    private Identifiers() {}

    public static String sanitize(String name) {
        return DANGEROUS.contains(name) ? SAFE_PREFIX + name : name;
    }

    public static boolean isDangerous(String name) {
        return DANGEROUS.contains(name);
    }

    static String seriesName(String name) {
        return "_series_" + sanitize(name);
    }

    static String accessorName(String name) {
        return "_getHistorical_" + sanitize(name);
    }
}
