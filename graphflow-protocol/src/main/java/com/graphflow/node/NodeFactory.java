package com.graphflow.node;

/**
 * Creates a node implementation for a node of the registered type. Called once per node at graph build time;
 * the instance is shared by all runs of the graph and must not keep per-run state.
 */
@FunctionalInterface
public interface NodeFactory {

    NodeImplementation create(NodeDefinition definition);

    /** Factory returning the same shared instance for every node. */
    static NodeFactory of(NodeImplementation instance) {
        return definition -> instance;
    }
}
