package com.graphflow.node;

import com.graphflow.state.StateContainer;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one node execution: the node's output state, an optional explicit next-node list that
 * bypasses edge routing (dynamic fan-out), and an optional error.
 */
public final class NodeExecutionResult {

    private final StateContainer state;
    private final List<String> explicitNext;
    private final ErrorInfo error;

    private NodeExecutionResult(StateContainer state, List<String> explicitNext, ErrorInfo error) {
        this.state = Objects.requireNonNull(state, "state");
        this.explicitNext = explicitNext != null ? List.copyOf(explicitNext) : null;
        this.error = error;
    }

    /** Success; next node(s) resolved by the router. */
    public static NodeExecutionResult of(StateContainer state) {
        return new NodeExecutionResult(state, null, null);
    }

    /** Success; next node(s) forced. An empty list ends the run at this node. */
    public static NodeExecutionResult goTo(StateContainer state, List<String> nextNodeIds) {
        return new NodeExecutionResult(state, Objects.requireNonNull(nextNodeIds, "nextNodeIds"), null);
    }

    public static NodeExecutionResult goTo(StateContainer state, String... nextNodeIds) {
        return goTo(state, List.of(nextNodeIds));
    }

    /** Failure reported without throwing; the state is not merged. */
    public static NodeExecutionResult failed(StateContainer state, ErrorInfo error) {
        return new NodeExecutionResult(state, null, Objects.requireNonNull(error, "error"));
    }

    public StateContainer getState() {
        return state;
    }

    public Optional<List<String>> getExplicitNext() {
        return Optional.ofNullable(explicitNext);
    }

    public Optional<ErrorInfo> getError() {
        return Optional.ofNullable(error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
