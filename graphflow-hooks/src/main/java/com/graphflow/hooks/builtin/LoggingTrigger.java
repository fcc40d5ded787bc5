package com.graphflow.hooks.builtin;

import com.graphflow.annotations.GraphHook;
import com.graphflow.annotations.HookPhase;
import com.graphflow.hooks.NodeHookContext;
import com.graphflow.hooks.RunPlugin;
import com.graphflow.hooks.Trigger;
import com.graphflow.node.ExecutionContext;
import com.graphflow.node.NodeExecutionResult;
import com.graphflow.state.StateContainer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Logs run lifecycle and every node invocation. Nodes slower than the threshold are logged at warn.
 */
@GraphHook(name = "logging", phase = HookPhase.AROUND_NODE)
public final class LoggingTrigger implements Trigger, RunPlugin {

    private static final Logger log = LoggerFactory.getLogger(LoggingTrigger.class);

    public static final Duration DEFAULT_SLOW_THRESHOLD = Duration.ofSeconds(5);

    private final Duration slowThreshold;

    public LoggingTrigger() {
        this(DEFAULT_SLOW_THRESHOLD);
    }

    public LoggingTrigger(Duration slowThreshold) {
        this.slowThreshold = Objects.requireNonNull(slowThreshold, "slowThreshold");
    }

    @Override
    public void onRunStart(ExecutionContext context) {
        log.info("Run started | executionId={} | workflowId={}", context.getExecutionId(), context.getWorkflowId());
    }

    @Override
    public void onRunEnd(ExecutionContext context, StateContainer finalState) {
        log.info("Run ended | executionId={} | workflowId={} | revision={} | keys={}",
                context.getExecutionId(), context.getWorkflowId(), finalState.getRevision(), finalState.values().keySet());
    }

    @Override
    public void onError(ExecutionContext context, Throwable error) {
        log.warn("Run errored | executionId={} | workflowId={} | error={}",
                context.getExecutionId(), context.getWorkflowId(), error.toString());
    }

    @Override
    public boolean before(NodeHookContext context) {
        log.debug("Node starting | executionId={} | step={} | nodeId={} | type={}",
                context.getExecutionId(), context.getStepNumber(), context.getNodeId(), context.getNodeType());
        return true;
    }

    @Override
    public void after(NodeHookContext context, NodeExecutionResult result) {
        Duration elapsed = context.getElapsed();
        if (elapsed.compareTo(slowThreshold) > 0) {
            log.warn("Slow node | executionId={} | nodeId={} | elapsedMs={} | thresholdMs={}",
                    context.getExecutionId(), context.getNodeId(), elapsed.toMillis(), slowThreshold.toMillis());
        } else {
            log.info("Node finished | executionId={} | step={} | nodeId={} | elapsedMs={}",
                    context.getExecutionId(), context.getStepNumber(), context.getNodeId(), elapsed.toMillis());
        }
    }

    @Override
    public void onNodeError(NodeHookContext context, Throwable error) {
        log.warn("Node failed | executionId={} | nodeId={} | error={}",
                context.getExecutionId(), context.getNodeId(), error.toString());
    }
}
