package com.graphflow.node;

import java.util.Map;

/**
 * Creates a guard predicate from the guard params declared on an edge.
 */
@FunctionalInterface
public interface GuardFactory {

    GuardPredicate create(Map<String, Object> params);
}
