package com.graphflow.state.checkpoint;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.graphflow.state.DeepCopy;
import com.graphflow.state.HistoryEntry;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted image of a run: initial values, current state values and revision, the retained history,
 * and the cursor (work to execute next; empty once the run has completed).
 */
public final class Checkpoint {

    private final String executionId;
    private final String workflowId;
    private final long revision;
    private final Map<String, Object> initialValues;
    private final Map<String, Object> values;
    private final List<HistoryEntry> history;
    private final List<CursorEntry> cursor;
    private final String status;
    private final int stepCount;
    private final Instant savedAt;

    @JsonCreator
    public Checkpoint(
            @JsonProperty("executionId") String executionId,
            @JsonProperty("workflowId") String workflowId,
            @JsonProperty("revision") long revision,
            @JsonProperty("initialValues") Map<String, Object> initialValues,
            @JsonProperty("values") Map<String, Object> values,
            @JsonProperty("history") List<HistoryEntry> history,
            @JsonProperty("cursor") List<CursorEntry> cursor,
            @JsonProperty("status") String status,
            @JsonProperty("stepCount") int stepCount,
            @JsonProperty("savedAt") Instant savedAt) {
        this.executionId = Objects.requireNonNull(executionId, "executionId");
        this.workflowId = workflowId;
        this.revision = revision;
        this.initialValues = Collections.unmodifiableMap(DeepCopy.copyMap(initialValues));
        this.values = Collections.unmodifiableMap(DeepCopy.copyMap(values));
        this.history = history != null ? List.copyOf(history) : List.of();
        this.cursor = cursor != null ? List.copyOf(cursor) : List.of();
        this.status = status;
        this.stepCount = stepCount;
        this.savedAt = savedAt != null ? savedAt : Instant.now();
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public long getRevision() {
        return revision;
    }

    /** Values the run started from; base for replaying {@link #getHistory()}. */
    public Map<String, Object> getInitialValues() {
        return initialValues;
    }

    public Map<String, Object> getValues() {
        return values;
    }

    public List<HistoryEntry> getHistory() {
        return history;
    }

    /** Work the run would execute next, head first; empty when the run has completed. */
    public List<CursorEntry> getCursor() {
        return cursor;
    }

    /** Run status name at save time (e.g. RUNNING, COMPLETED, FAILED). */
    public String getStatus() {
        return status;
    }

    public int getStepCount() {
        return stepCount;
    }

    public Instant getSavedAt() {
        return savedAt;
    }
}
