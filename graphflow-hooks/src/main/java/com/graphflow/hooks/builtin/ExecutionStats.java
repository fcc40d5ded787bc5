package com.graphflow.hooks.builtin;

import java.time.Duration;
import java.util.Map;

/**
 * Summary of one run collected by {@link ExecutionStatsPlugin}.
 *
 * @param totalDuration wall time from run start to end
 * @param nodeRuns      successful executions per node id, in first-seen order
 * @param nodeTime      accumulated execution time per node id
 * @param skipped       vetoed invocations
 * @param failures      nodes that failed for good
 * @param slowestNodeId node with the largest accumulated time; null if no node ran
 */
public record ExecutionStats(String executionId, String workflowId, boolean succeeded, Duration totalDuration,
                             Map<String, Integer> nodeRuns, Map<String, Duration> nodeTime, int skipped,
                             int failures, String slowestNodeId) {

    public ExecutionStats {
        nodeRuns = Map.copyOf(nodeRuns);
        nodeTime = Map.copyOf(nodeTime);
    }

    public int totalNodeRuns() {
        return nodeRuns.values().stream().mapToInt(Integer::intValue).sum();
    }
}
