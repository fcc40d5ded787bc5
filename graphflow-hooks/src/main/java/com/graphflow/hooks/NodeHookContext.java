package com.graphflow.hooks;

import com.graphflow.node.ExecutionContext;
import com.graphflow.state.StateDelta;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Context passed to triggers for one node invocation. The state is a read-only view. The same invocation's
 * {@code before} and {@code after} calls share attributes, requested amendments and the start time;
 * {@link #afterExecution(Map)} returns the post-execution view.
 */
public final class NodeHookContext {

    private final String nodeId;
    private final String nodeType;
    private final int stepNumber;
    private final Map<String, Object> state;
    private final ExecutionContext executionContext;
    private final Shared shared;

    public NodeHookContext(String nodeId, String nodeType, int stepNumber, Map<String, Object> state,
                           ExecutionContext executionContext) {
        this(nodeId, nodeType, stepNumber, state, executionContext, new Shared());
    }

    private NodeHookContext(String nodeId, String nodeType, int stepNumber, Map<String, Object> state,
                            ExecutionContext executionContext, Shared shared) {
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
        this.nodeType = nodeType != null ? nodeType : "";
        this.stepNumber = stepNumber;
        this.state = state != null ? Collections.unmodifiableMap(state) : Map.of();
        this.executionContext = Objects.requireNonNull(executionContext, "executionContext");
        this.shared = shared;
    }

    /** Same invocation, state after the node's output was committed. */
    public NodeHookContext afterExecution(Map<String, Object> stateAfter) {
        return new NodeHookContext(nodeId, nodeType, stepNumber, stateAfter, executionContext, shared);
    }

    public String getNodeId() {
        return nodeId;
    }

    public String getNodeType() {
        return nodeType;
    }

    /** 1-based step number within the run. */
    public int getStepNumber() {
        return stepNumber;
    }

    /** Read-only state values. */
    public Map<String, Object> getState() {
        return state;
    }

    public ExecutionContext getExecutionContext() {
        return executionContext;
    }

    public String getExecutionId() {
        return executionContext.getExecutionId();
    }

    /** Time since the invocation's context was created (i.e. since before-hooks started). */
    public Duration getElapsed() {
        return Duration.ofNanos(System.nanoTime() - shared.startNanos);
    }

    /** Scratch space shared by hooks for this invocation (e.g. a timer sample). */
    public Map<String, Object> getAttributes() {
        return shared.attributes;
    }

    /** Asks the orchestrator to set {@code key} after this node; recorded as an AMENDMENT history entry. */
    public void requestAmendment(String key, Object value) {
        Objects.requireNonNull(key, "key");
        synchronized (shared) {
            shared.removals.remove(key);
            shared.updates.put(key, value);
        }
    }

    /** Asks the orchestrator to remove {@code key} after this node. */
    public void requestRemoval(String key) {
        Objects.requireNonNull(key, "key");
        synchronized (shared) {
            shared.updates.remove(key);
            shared.removals.add(key);
        }
    }

    /** Amendments requested so far, as one delta; empty if none. */
    public StateDelta pendingAmendment() {
        synchronized (shared) {
            List<String> removed = new ArrayList<>(shared.removals);
            return new StateDelta(new LinkedHashMap<>(shared.updates), removed);
        }
    }

    private static final class Shared {
        private final long startNanos = System.nanoTime();
        private final Map<String, Object> attributes = new ConcurrentHashMap<>();
        private final Map<String, Object> updates = new LinkedHashMap<>();
        private final Set<String> removals = new LinkedHashSet<>();
    }
}
