package com.graphflow.graph;

import com.graphflow.node.GuardPredicate;

import java.util.Map;
import java.util.Objects;

/**
 * Built edge. {@code index} is the declaration order across the whole graph.
 */
public final class Edge {

    private final int index;
    private final String from;
    private final String to;
    private final GuardPredicate guard;
    private final String guardLabel;
    private final String description;

    Edge(int index, String from, String to, GuardPredicate guard, String guardLabel, String description) {
        this.index = index;
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
        this.guard = guard;
        this.guardLabel = guardLabel;
        this.description = description;
    }

    public int getIndex() {
        return index;
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }

    /** Null when unconditional. */
    public GuardPredicate getGuard() {
        return guard;
    }

    /** Human-readable guard, e.g. {@code greater_or_equal(key=count, value=3)}; null when unconditional. */
    public String getGuardLabel() {
        return guardLabel;
    }

    public String getDescription() {
        return description;
    }

    public boolean isUnconditional() {
        return guard == null;
    }

    public boolean isEligible(Map<String, Object> values) {
        return guard == null || guard.evaluate(values);
    }

    @Override
    public String toString() {
        return from + " -> " + to + (guardLabel != null ? " [" + guardLabel + "]" : "");
    }
}
