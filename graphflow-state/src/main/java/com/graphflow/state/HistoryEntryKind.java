package com.graphflow.state;

/**
 * Origin of a history entry.
 */
public enum HistoryEntryKind {
    /** Output of a node execution. */
    NODE,
    /** Node vetoed by a before-trigger; delta is empty. */
    SKIPPED,
    /** Values replaced from a snapshot. */
    RESTORE,
    /** Change requested by a hook and applied by the orchestrator. */
    AMENDMENT,
    /** Adjustment made by a merge strategy when joining parallel branches. */
    MERGE
}
