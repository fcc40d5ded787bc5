package com.graphflow.registry;

import com.graphflow.node.GuardFactory;
import com.graphflow.node.NodeFactory;

/**
 * The node-type and guard namespaces an engine builds graphs against. Hooks live in their own registry
 * in the hooks module. The same name may exist in both namespaces without conflict.
 */
public final class ComponentRegistries {

    public static final String NODES = "nodes";
    public static final String GUARDS = "guards";

    private final ComponentRegistry<NodeFactory> nodes;
    private final ComponentRegistry<GuardFactory> guards;

    public ComponentRegistries() {
        this(new ComponentRegistry<>(NODES), new ComponentRegistry<>(GUARDS));
    }

    private ComponentRegistries(ComponentRegistry<NodeFactory> nodes, ComponentRegistry<GuardFactory> guards) {
        this.nodes = nodes;
        this.guards = guards;
    }

    public ComponentRegistry<NodeFactory> nodes() {
        return nodes;
    }

    public ComponentRegistry<GuardFactory> guards() {
        return guards;
    }

    public ComponentRegistries registerNode(String type, NodeFactory factory) {
        nodes.register(type, factory);
        return this;
    }

    public ComponentRegistries registerGuard(String name, GuardFactory factory) {
        guards.register(name, factory);
        return this;
    }

    public void freeze() {
        nodes.freeze();
        guards.freeze();
    }

    public ComponentRegistries copy() {
        return new ComponentRegistries(nodes.copy(), guards.copy());
    }
}
