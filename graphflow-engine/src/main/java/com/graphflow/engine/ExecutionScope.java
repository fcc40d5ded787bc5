package com.graphflow.engine;

import com.graphflow.state.HistoryEntry;
import com.graphflow.state.HistoryEntryKind;
import com.graphflow.state.StateContainer;
import com.graphflow.state.StateDelta;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * State, cursor and history sink of one line of execution: the run's main path, or one parallel branch.
 * A branch works on a private copy of the state and collects its history locally until the join.
 */
final class ExecutionScope {

    final RunHandle run;
    final StateContainer state;
    final Deque<WorkItem> cursor;
    final String label;
    private final List<HistoryEntry> branchEntries;

    private ExecutionScope(RunHandle run, StateContainer state, Deque<WorkItem> cursor, String label,
                           List<HistoryEntry> branchEntries) {
        this.run = run;
        this.state = state;
        this.cursor = cursor;
        this.label = label;
        this.branchEntries = branchEntries;
    }

    static ExecutionScope main(RunHandle run) {
        return new ExecutionScope(run, run.state(), run.cursor(), "main", null);
    }

    ExecutionScope branch(String startNodeId, String stopAt) {
        Deque<WorkItem> branchCursor = new ConcurrentLinkedDeque<>();
        branchCursor.add(WorkItem.pending(startNodeId, stopAt));
        return new ExecutionScope(run, state.copy(), branchCursor, label + "/" + startNodeId,
                Collections.synchronizedList(new ArrayList<>()));
    }

    boolean isMain() {
        return branchEntries == null;
    }

    /** Commits a delta and records it as one entry; the two are atomic with respect to snapshot and restore. */
    long commit(String nodeId, StateDelta delta, HistoryEntryKind kind, String detail) {
        synchronized (run.lock) {
            long revision = state.commit(delta);
            record(new HistoryEntry(revision, nodeId, Instant.now(), delta, kind, detail));
            return revision;
        }
    }

    /** Records a skip at the current revision; the state is not touched. */
    void recordSkip(String nodeId, String vetoedBy) {
        synchronized (run.lock) {
            record(new HistoryEntry(state.getRevision(), nodeId, Instant.now(), StateDelta.empty(),
                    HistoryEntryKind.SKIPPED, "vetoedBy=" + vetoedBy));
        }
    }

    /** Re-commits an entry produced in a child branch, keeping its node, kind, detail and timestamp. */
    void adopt(HistoryEntry entry) {
        synchronized (run.lock) {
            long revision = entry.getKind() == HistoryEntryKind.SKIPPED
                    ? state.getRevision()
                    : state.commit(entry.getDelta());
            record(new HistoryEntry(revision, entry.getNodeId(), entry.getTimestamp(), entry.getDelta(),
                    entry.getKind(), entry.getDetail()));
        }
    }

    List<HistoryEntry> branchEntries() {
        synchronized (branchEntries) {
            return List.copyOf(branchEntries);
        }
    }

    private void record(HistoryEntry entry) {
        if (branchEntries == null) {
            run.history().append(entry);
        } else {
            branchEntries.add(entry);
        }
    }
}
