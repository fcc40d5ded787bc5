package com.graphflow.engine;

import com.graphflow.state.checkpoint.CursorEntry;

import java.util.List;

/**
 * Cursor element: a node to execute, or an executed node whose successors are still to be scheduled.
 * {@code stopAt} bounds a fan-out branch; the branch ends when it reaches that node.
 */
final class WorkItem {

    final String nodeId;
    final String stopAt;
    final boolean executed;
    final List<String> next;

    private WorkItem(String nodeId, String stopAt, boolean executed, List<String> next) {
        this.nodeId = nodeId;
        this.stopAt = stopAt;
        this.executed = executed;
        this.next = next != null ? List.copyOf(next) : null;
    }

    static WorkItem pending(String nodeId, String stopAt) {
        return new WorkItem(nodeId, stopAt, false, null);
    }

    static WorkItem executed(String nodeId, String stopAt, List<String> explicitNext) {
        return new WorkItem(nodeId, stopAt, true, explicitNext);
    }

    boolean reachedStop() {
        return !executed && nodeId.equals(stopAt);
    }

    CursorEntry toEntry() {
        return new CursorEntry(nodeId, stopAt, executed, next);
    }

    static WorkItem fromEntry(CursorEntry entry) {
        return new WorkItem(entry.getNodeId(), entry.getStopAt(), entry.isExecuted(), entry.getNext());
    }

    @Override
    public String toString() {
        return toEntry().toString();
    }
}
