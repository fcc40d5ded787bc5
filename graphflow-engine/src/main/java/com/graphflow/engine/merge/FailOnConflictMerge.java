package com.graphflow.engine.merge;

import com.graphflow.state.StateDelta;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Like {@link LastWriteWinsMerge}, but rejects the join when two branches leave a key with different
 * outcomes (different values, or one removes what another writes). Identical writes are not conflicts.
 */
public final class FailOnConflictMerge implements MergeStrategy {

    private static final Object REMOVED = new Object();

    private final LastWriteWinsMerge delegate = new LastWriteWinsMerge();

    @Override
    public String name() {
        return MergePolicy.FAIL_ON_CONFLICT.name();
    }

    @Override
    public Map<String, Object> merge(Map<String, Object> base, List<BranchOutcome> branches) {
        Map<String, Object> firstOutcome = new HashMap<>();
        Set<String> conflicts = new TreeSet<>();
        for (BranchOutcome branch : branches) {
            StateDelta changes = branch.getChanges();
            for (String key : changes.touchedKeys()) {
                Object outcome = changes.getRemoved().contains(key) ? REMOVED : changes.getUpdates().get(key);
                if (!firstOutcome.containsKey(key)) {
                    firstOutcome.put(key, outcome);
                } else if (!Objects.equals(firstOutcome.get(key), outcome)) {
                    conflicts.add(key);
                }
            }
        }
        if (!conflicts.isEmpty()) {
            throw new MergeConflictException(conflicts);
        }
        return delegate.merge(base, branches);
    }
}
