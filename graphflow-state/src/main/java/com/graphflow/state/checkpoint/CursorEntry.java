package com.graphflow.state.checkpoint;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * One pending unit of work of a run: the node to execute next and, inside a fan-out branch,
 * the node at which the branch stops ({@code stopAt}; null on the main path).
 * <p>
 * An {@code executed} entry marks a node whose output is already committed but whose successors
 * have not been scheduled yet; {@code next} then holds the node's explicit targets, or is null
 * when the successors come from edge routing.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CursorEntry {

    private final String nodeId;
    private final String stopAt;
    private final boolean executed;
    private final List<String> next;

    @JsonCreator
    public CursorEntry(
            @JsonProperty("nodeId") String nodeId,
            @JsonProperty("stopAt") String stopAt,
            @JsonProperty("executed") boolean executed,
            @JsonProperty("next") List<String> next) {
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
        this.stopAt = stopAt;
        this.executed = executed;
        this.next = next != null ? List.copyOf(next) : null;
    }

    public CursorEntry(String nodeId, String stopAt) {
        this(nodeId, stopAt, false, null);
    }

    public static CursorEntry of(String nodeId) {
        return new CursorEntry(nodeId, null);
    }

    public String getNodeId() {
        return nodeId;
    }

    public String getStopAt() {
        return stopAt;
    }

    public boolean isExecuted() {
        return executed;
    }

    public List<String> getNext() {
        return next;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CursorEntry that = (CursorEntry) o;
        return executed == that.executed && nodeId.equals(that.nodeId)
                && Objects.equals(stopAt, that.stopAt) && Objects.equals(next, that.next);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodeId, stopAt, executed, next);
    }

    @Override
    public String toString() {
        String s = executed ? nodeId + " (routing" + (next != null ? " to " + next : "") + ")" : nodeId;
        return stopAt != null ? s + " (until " + stopAt + ")" : s;
    }
}
