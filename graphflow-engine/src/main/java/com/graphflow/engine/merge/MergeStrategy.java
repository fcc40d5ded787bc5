package com.graphflow.engine.merge;

import java.util.List;
import java.util.Map;

/**
 * Combines the outcomes of parallel branches at their join. Branches are passed in edge declaration order.
 */
public interface MergeStrategy {

    String name();

    /**
     * @param base values at the fan-out node, before any branch ran
     * @return merged values; must not modify {@code base}
     * @throws MergeConflictException if the strategy rejects the combination
     */
    Map<String, Object> merge(Map<String, Object> base, List<BranchOutcome> branches);
}
