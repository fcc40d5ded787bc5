package com.graphflow.engine.merge;

import com.graphflow.state.StateDelta;
import com.graphflow.state.StateDiff;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * Final values of one completed parallel branch, with the changes it made relative to the fan-out state.
 */
public final class BranchOutcome {

    private final String branchId;
    private final Map<String, Object> values;
    private final StateDelta changes;

    public BranchOutcome(String branchId, Map<String, Object> values, StateDelta changes) {
        this.branchId = Objects.requireNonNull(branchId, "branchId");
        this.values = Collections.unmodifiableMap(values);
        this.changes = Objects.requireNonNull(changes, "changes");
    }

    /** Outcome whose changes are the diff between the fan-out state and the branch's final values. */
    public static BranchOutcome of(String branchId, Map<String, Object> base, Map<String, Object> values) {
        return new BranchOutcome(branchId, values, StateDiff.between(base, values));
    }

    /** Id of the branch's first node. */
    public String getBranchId() {
        return branchId;
    }

    public Map<String, Object> getValues() {
        return values;
    }

    public StateDelta getChanges() {
        return changes;
    }

    @Override
    public String toString() {
        return "BranchOutcome{" + branchId + " " + changes + "}";
    }
}
