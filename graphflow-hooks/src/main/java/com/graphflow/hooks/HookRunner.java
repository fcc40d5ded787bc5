package com.graphflow.hooks;

import com.graphflow.node.ExecutionContext;
import com.graphflow.node.NodeExecutionResult;
import com.graphflow.state.StateContainer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Invokes registered hooks in registration order. Observer failures are logged and the run continues;
 * critical failures are rethrown as {@link HookFailureException}. {@code onError} failures are never rethrown.
 */
public final class HookRunner {

    private static final Logger log = LoggerFactory.getLogger(HookRunner.class);

    private final HookRegistry registry;

    public HookRunner(HookRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public HookRegistry getRegistry() {
        return registry;
    }

    /**
     * Runs before-triggers until one vetoes.
     *
     * @return name of the vetoing hook, or empty if the node may run
     */
    public Optional<String> runBefore(NodeHookContext context) {
        for (HookEntry e : registry.triggersFor(context.getNodeType())) {
            if (!e.runsBefore()) continue;
            Trigger trigger = (Trigger) e.getInstance();
            boolean allow;
            try {
                allow = trigger.before(context);
            } catch (RuntimeException | Error t) {
                handle(e, "before", context.getExecutionId(), t);
                allow = true;
            }
            if (!allow) {
                log.info("Node vetoed by hook | executionId={} | nodeId={} | hook={}",
                        context.getExecutionId(), context.getNodeId(), e.getName());
                notifySkipped(context, e.getName());
                return Optional.of(e.getName());
            }
        }
        return Optional.empty();
    }

    private void notifySkipped(NodeHookContext context, String vetoedBy) {
        for (HookEntry e : registry.triggersFor(context.getNodeType())) {
            try {
                ((Trigger) e.getInstance()).onSkipped(context, vetoedBy);
            } catch (RuntimeException | Error t) {
                handle(e, "onSkipped", context.getExecutionId(), t);
            }
        }
    }

    public void runAfter(NodeHookContext context, NodeExecutionResult result) {
        for (HookEntry e : registry.triggersFor(context.getNodeType())) {
            if (!e.runsAfter()) continue;
            try {
                ((Trigger) e.getInstance()).after(context, result);
            } catch (RuntimeException | Error t) {
                handle(e, "after", context.getExecutionId(), t);
            }
        }
    }

    public void runNodeError(NodeHookContext context, Throwable error) {
        for (HookEntry e : registry.triggersFor(context.getNodeType())) {
            try {
                ((Trigger) e.getInstance()).onNodeError(context, error);
            } catch (RuntimeException | Error t) {
                log.warn("Hook onNodeError failed; continuing | executionId={} | hook={}",
                        context.getExecutionId(), e.getName(), t);
            }
        }
    }

    public void runStart(ExecutionContext context) {
        for (HookEntry e : registry.runPlugins()) {
            try {
                ((RunPlugin) e.getInstance()).onRunStart(context);
            } catch (RuntimeException | Error t) {
                handle(e, "onRunStart", context.getExecutionId(), t);
            }
        }
    }

    public void runEnd(ExecutionContext context, StateContainer finalState) {
        for (HookEntry e : registry.runPlugins()) {
            try {
                ((RunPlugin) e.getInstance()).onRunEnd(context, finalState);
            } catch (RuntimeException | Error t) {
                handle(e, "onRunEnd", context.getExecutionId(), t);
            }
        }
    }

    public void runError(ExecutionContext context, Throwable error) {
        for (HookEntry e : registry.runPlugins()) {
            try {
                ((RunPlugin) e.getInstance()).onError(context, error);
            } catch (RuntimeException | Error t) {
                log.warn("Hook onError failed; continuing | executionId={} | hook={}",
                        context.getExecutionId(), e.getName(), t);
            }
        }
    }

    private static void handle(HookEntry entry, String method, String executionId, Throwable t) {
        if (entry.isCritical()) {
            throw new HookFailureException(entry.getName(), method, t);
        }
        log.warn("Observer hook {} failed in {}; continuing | executionId={}", entry.getName(), method, executionId, t);
    }
}
