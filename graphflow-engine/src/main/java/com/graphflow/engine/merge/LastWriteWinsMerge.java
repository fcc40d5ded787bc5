package com.graphflow.engine.merge;

import com.graphflow.state.DeepCopy;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies each branch's changes in branch order: disjoint writes are all kept, and for an overlapping key the
 * later branch wins.
 */
public final class LastWriteWinsMerge implements MergeStrategy {

    @Override
    public String name() {
        return MergePolicy.LAST_WRITE_WINS.name();
    }

    @Override
    public Map<String, Object> merge(Map<String, Object> base, List<BranchOutcome> branches) {
        Map<String, Object> merged = new LinkedHashMap<>(DeepCopy.copyMap(base));
        for (BranchOutcome branch : branches) {
            branch.getChanges().applyTo(merged);
        }
        return merged;
    }
}
