package com.graphflow.node;

import java.util.Map;

/**
 * Edge guard evaluated against the live state values. Must be pure and side-effect free.
 */
@FunctionalInterface
public interface GuardPredicate {

    boolean evaluate(Map<String, Object> values);

    /** Label used in visualization and diagnostics. */
    default String describe() {
        return getClass().getSimpleName();
    }

    static GuardPredicate always() {
        return values -> true;
    }
}
