package com.graphflow.engine.routing;

import com.graphflow.graph.Edge;
import com.graphflow.graph.GraphModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves the next node(s) from declared edges: every eligible outgoing edge, in declaration order.
 * A target reached by several eligible edges appears once. Stateless and deterministic.
 */
public final class Router {

    private static final Logger log = LoggerFactory.getLogger(Router.class);

    /**
     * @return eligible targets in edge order; empty if the node is terminal and nothing is eligible
     * @throws NoEligibleEdgeException if nothing is eligible and the node is not terminal
     */
    public List<String> resolveNext(GraphModel graph, String nodeId, Map<String, Object> values) {
        Map<String, Object> view = Collections.unmodifiableMap(values);
        Set<String> targets = new LinkedHashSet<>();
        for (Edge edge : graph.outgoing(nodeId)) {
            if (edge.isEligible(view)) {
                targets.add(edge.getTo());
            }
        }
        if (targets.isEmpty() && !graph.isTerminal(nodeId)) {
            throw new NoEligibleEdgeException(nodeId, values);
        }
        List<String> next = new ArrayList<>(targets);
        log.debug("Routed | nodeId={} | next={}", nodeId, next);
        return next;
    }
}
