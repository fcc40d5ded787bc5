package com.graphflow.graph;

import com.graphflow.node.ExecutionCapability;
import com.graphflow.node.NodeImplementation;

import java.util.Map;
import java.util.Objects;

/**
 * Built node: immutable after {@link GraphBuilder#build}. The implementation instance is shared by all runs.
 * An {@link #isEndMarker() end marker} has no implementation; reaching it completes the run.
 */
public final class Node {

    /** Reserved type: needs no registration, terminal, never executed. */
    public static final String END_TYPE = "end";

    private final String id;
    private final String type;
    private final ExecutionCapability capability;
    private final Map<String, Object> config;
    private final NodeImplementation implementation;
    private final boolean terminal;
    private final boolean parallel;
    private final String join;
    private final String description;

    Node(String id, String type, ExecutionCapability capability, Map<String, Object> config,
         NodeImplementation implementation, boolean terminal, boolean parallel, String join, String description) {
        this.id = Objects.requireNonNull(id, "id");
        this.type = Objects.requireNonNull(type, "type");
        this.capability = capability;
        this.config = config != null ? Map.copyOf(config) : Map.of();
        this.implementation = implementation;
        this.terminal = terminal;
        this.parallel = parallel;
        this.join = join;
        this.description = description;
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    /** Effective capability: the implementation's, narrowed by the descriptor if it declared one. Null for end markers. */
    public ExecutionCapability getCapability() {
        return capability;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    /** Null for end markers. */
    public NodeImplementation getImplementation() {
        return implementation;
    }

    /** Declared terminal (or an end marker). See {@link GraphModel#isTerminal(String)} for the effective rule. */
    public boolean isTerminal() {
        return terminal;
    }

    public boolean isParallel() {
        return parallel;
    }

    /** Join node id for fan-out from this node, or null. */
    public String getJoin() {
        return join;
    }

    public String getDescription() {
        return description;
    }

    public boolean isEndMarker() {
        return END_TYPE.equals(type);
    }

    @Override
    public String toString() {
        return "Node{id=" + id + ", type=" + type + ", capability=" + capability + "}";
    }
}
