package com.graphflow.engine;

import com.graphflow.engine.cancel.CancellationToken;
import com.graphflow.graph.GraphModel;
import com.graphflow.node.ExecutionContext;
import com.graphflow.state.DeepCopy;
import com.graphflow.state.History;
import com.graphflow.state.HistoryEntry;
import com.graphflow.state.Snapshot;
import com.graphflow.state.SnapshotStore;
import com.graphflow.state.StateContainer;
import com.graphflow.state.checkpoint.Checkpoint;
import com.graphflow.state.checkpoint.CursorEntry;

import java.time.Instant;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * One run of a graph: its live state, history, snapshots, cursor and status. Created by
 * {@link Orchestrator#newRun} or {@link Orchestrator#resume}; started once. After the run ends the handle
 * keeps the last consistent state and the history for inspection.
 */
public final class RunHandle {

    final Object lock = new Object();

    private final String executionId;
    private final GraphModel graph;
    private final ExecutionContext context;
    private final Map<String, Object> initialValues;
    private final StateContainer state;
    private final History history;
    private final SnapshotStore snapshots = new SnapshotStore();
    private final CancellationToken cancellation;
    private final Deque<WorkItem> cursor = new ConcurrentLinkedDeque<>();
    private final AtomicInteger stepCount;
    private final AtomicReference<RunStatus> status = new AtomicReference<>(RunStatus.PENDING);
    private volatile Throwable failure;
    private volatile int lastCheckpointStep;

    RunHandle(GraphModel graph, ExecutionContext context, Map<String, ?> initialValues, StateContainer state,
              History history, List<WorkItem> cursor, int stepCount) {
        this.executionId = context.getExecutionId();
        this.graph = graph;
        this.cancellation = new CancellationToken(executionId);
        this.context = context.withCancellationSignal(cancellation::isCancelled);
        this.initialValues = Collections.unmodifiableMap(DeepCopy.copyMap(initialValues));
        this.state = state;
        this.history = history;
        this.cursor.addAll(cursor);
        this.stepCount = new AtomicInteger(stepCount);
        this.lastCheckpointStep = stepCount;
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getWorkflowId() {
        return graph.getWorkflowId();
    }

    public GraphModel getGraph() {
        return graph;
    }

    public ExecutionContext getContext() {
        return context;
    }

    public RunStatus getStatus() {
        return status.get();
    }

    public boolean isDone() {
        return status.get().isTerminal();
    }

    /** Copy of the current state. */
    public StateContainer getState() {
        synchronized (lock) {
            return state.copy();
        }
    }

    /** Current values (stable, unmodifiable). */
    public Map<String, Object> values() {
        return state.values();
    }

    public long getRevision() {
        return state.getRevision();
    }

    public Map<String, Object> getInitialValues() {
        return initialValues;
    }

    /** Retained history entries, oldest first. */
    public List<HistoryEntry> getHistory() {
        return history.entries();
    }

    /**
     * Values obtained by replaying the history on top of the initial values.
     *
     * @throws IllegalStateException if history entries were evicted by the retention limit
     */
    public Map<String, Object> replayHistory() {
        return history.replay(initialValues);
    }

    public List<Snapshot> getSnapshots() {
        return snapshots.list();
    }

    /** Steps executed or skipped so far, including parallel branches. */
    public int getStepCount() {
        return stepCount.get();
    }

    /** Error that ended the run, if it failed or was cancelled. */
    public Optional<Throwable> getFailure() {
        return Optional.ofNullable(failure);
    }

    /** Work still to do on the main path, head first. Empty once the run has completed. */
    public List<CursorEntry> getCursor() {
        return cursor.stream().map(WorkItem::toEntry).collect(Collectors.toList());
    }

    public CancellationToken getCancellationToken() {
        return cancellation;
    }

    /** Requests cancellation; the run stops before its next step. */
    public void cancel() {
        cancellation.cancel();
    }

    /** Current image of the run, as saved to a checkpoint store. */
    public Checkpoint checkpoint() {
        synchronized (lock) {
            return new Checkpoint(executionId, graph.getWorkflowId(), state.getRevision(), initialValues,
                    state.values(), history.entries(), getCursor(), status.get().name(), stepCount.get(),
                    Instant.now());
        }
    }

    StateContainer state() {
        return state;
    }

    History history() {
        return history;
    }

    SnapshotStore snapshots() {
        return snapshots;
    }

    Deque<WorkItem> cursor() {
        return cursor;
    }

    boolean markRunning() {
        return status.compareAndSet(RunStatus.PENDING, RunStatus.RUNNING);
    }

    /** Moves a running run to its final status; false if it had already ended. */
    boolean finish(RunStatus finalStatus, Throwable error) {
        if (!status.compareAndSet(RunStatus.RUNNING, finalStatus)) {
            return false;
        }
        this.failure = error;
        cancellation.close();
        return true;
    }

    /**
     * Claims the next step number.
     *
     * @throws StepLimitExceededException if {@code maxSteps} steps were already taken
     */
    int claimStep(int maxSteps) {
        while (true) {
            int current = stepCount.get();
            if (current >= maxSteps) {
                throw new StepLimitExceededException(maxSteps);
            }
            if (stepCount.compareAndSet(current, current + 1)) {
                return current + 1;
            }
        }
    }

    /** True if at least {@code interval} steps ran since the last interval checkpoint; resets the mark. */
    boolean checkpointDue(int interval) {
        int steps = stepCount.get();
        if (interval <= 0 || steps - lastCheckpointStep < interval) {
            return false;
        }
        lastCheckpointStep = steps;
        return true;
    }

    @Override
    public String toString() {
        return "RunHandle{executionId=" + executionId + ", workflowId=" + graph.getWorkflowId()
                + ", status=" + status.get() + ", steps=" + stepCount.get() + "}";
    }
}
