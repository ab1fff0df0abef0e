package com.elara.pine.generator;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Tracks which historically indexed identifiers have their
 * {@code _series_x} / {@code _getHistorical_x} pair in each JavaScript block scope.
 * One instance per generated program.
 *
 * A declaration inside a block (function body, branch, loop, switch arm) opens a new JS
 * variable, so it needs its own pair even when an enclosing scope already has one.
 */
final class SeriesBindings {
    private final Set<String> historical;
    private final Deque<Set<String>> scopes = new ArrayDeque<>();

    SeriesBindings(Set<String> historical) {
        this.historical = Collections.unmodifiableSet(new LinkedHashSet<>(historical));
        scopes.push(new HashSet<>());
    }

    Set<String> historical() {
        return historical;
    }

    void enterScope() {
        scopes.push(new HashSet<>());
    }

    void exitScope() {
        if (scopes.size() == 1) throw new IllegalStateException("Cannot leave program scope.");
        scopes.pop();
    }

    /** True when {@code name} is indexed somewhere and the current scope has no binding for it. */
    boolean needsBinding(String name) {
        return historical.contains(name) && !scopes.peek().contains(name);
    }

    void markBound(String name) {
        scopes.peek().add(name);
    }

    /** A binding is visible from the current scope. */
    boolean isBound(String name) {
        for (Set<String> scope : scopes) {
            if (scope.contains(name)) return true;
        }
        return false;
    }

    /** The innermost visible binding lives in program scope, so reassignments push into it. */
    boolean isTopLevel(String name) {
        for (Set<String> scope : scopes) {
            if (scope.contains(name)) return scope == scopes.peekLast();
        }
        return false;
    }

    static String[] bindingLines(String name) {
        String value = Identifiers.sanitize(name);
        String series = Identifiers.seriesName(name);
        return new String[] {
                "const " + series + " = context.new_var(" + value + ");",
                "const " + Identifiers.accessorName(name) + " = (offset) => " + series + ".get(offset);"
        };
    }
}
