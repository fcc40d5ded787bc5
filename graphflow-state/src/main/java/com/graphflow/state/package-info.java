/**
 * Per-run state: {@link com.graphflow.state.StateContainer} (copy-on-write values with a revision),
 * {@link com.graphflow.state.History} (bounded append-only delta log),
 * {@link com.graphflow.state.SnapshotStore} (restorable copies) and the
 * {@link com.graphflow.state.checkpoint.CheckpointStore} boundary for persistence.
 */
package com.graphflow.state;
