package com.graphflow.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One immutable record of the history log: the delta committed at {@code revision} by {@code nodeId}.
 * {@code nodeId} is null for {@link HistoryEntryKind#RESTORE} entries.
 */
public final class HistoryEntry {

    private final long revision;
    private final String nodeId;
    private final Instant timestamp;
    private final StateDelta delta;
    private final HistoryEntryKind kind;
    private final String detail;

    @JsonCreator
    public HistoryEntry(
            @JsonProperty("revision") long revision,
            @JsonProperty("nodeId") String nodeId,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("delta") StateDelta delta,
            @JsonProperty("kind") HistoryEntryKind kind,
            @JsonProperty("detail") String detail) {
        this.revision = revision;
        this.nodeId = nodeId;
        this.timestamp = timestamp != null ? timestamp : Instant.now();
        this.delta = delta != null ? delta : StateDelta.empty();
        this.kind = kind != null ? kind : HistoryEntryKind.NODE;
        this.detail = detail;
    }

    public static HistoryEntry node(long revision, String nodeId, StateDelta delta) {
        return new HistoryEntry(revision, nodeId, Instant.now(), delta, HistoryEntryKind.NODE, null);
    }

    public long getRevision() {
        return revision;
    }

    public String getNodeId() {
        return nodeId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public StateDelta getDelta() {
        return delta;
    }

    public HistoryEntryKind getKind() {
        return kind;
    }

    /** Optional detail: hook name for AMENDMENT, snapshot id for RESTORE, veto reason for SKIPPED. */
    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return "HistoryEntry{" + revision + " " + kind + " " + nodeId + " " + delta + "}";
    }
}
