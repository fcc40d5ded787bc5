package com.graphflow.engine.subworkflow;

import com.graphflow.engine.Orchestrator;
import com.graphflow.engine.RunHandle;
import com.graphflow.graph.GraphModel;
import com.graphflow.node.ExecutionCapability;
import com.graphflow.node.ExecutionContext;
import com.graphflow.node.NodeDefinition;
import com.graphflow.node.NodeExecutionResult;
import com.graphflow.node.NodeFactory;
import com.graphflow.node.NodeImplementation;
import com.graphflow.state.StateContainer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * Node that runs another workflow as one step. The child run gets a deep copy of the parent's values and
 * its own history; when it completes, its final values become this node's output: merged over the parent's
 * values, or stored as one map under {@code output_key} when that config key is set.
 * <p>
 * The capability follows the child orchestrator's mode, so the child always runs at the call site the
 * parent's mode uses. A failed or cancelled child run fails this node; cancelling the suspended node
 * cancels the child run.
 */
public final class SubWorkflowNode implements NodeImplementation {

    /** Node type under which {@link #factory} is usually registered. */
    public static final String TYPE = "subworkflow";
    /** Config key: id of the workflow to run. */
    public static final String WORKFLOW_KEY = "workflow";
    /** Config key: optional state key receiving the child's final values. */
    public static final String OUTPUT_KEY = "output_key";
    /** Parameter passed to the child run's context. */
    public static final String PARENT_EXECUTION_ID = "parentExecutionId";

    private static final Logger log = LoggerFactory.getLogger(SubWorkflowNode.class);

    private final Orchestrator child;
    private final String workflowId;
    private final Function<String, GraphModel> graphs;
    private final String outputKey;

    public SubWorkflowNode(Orchestrator child, String workflowId, Function<String, GraphModel> graphs,
                           String outputKey) {
        this.child = Objects.requireNonNull(child, "child");
        this.workflowId = Objects.requireNonNull(workflowId, "workflowId");
        this.graphs = Objects.requireNonNull(graphs, "graphs");
        this.outputKey = outputKey;
    }

    public SubWorkflowNode(Orchestrator child, GraphModel graph) {
        this(child, graph.getWorkflowId(), id -> graph, null);
    }

    /**
     * Factory reading {@value #WORKFLOW_KEY} and {@value #OUTPUT_KEY} from the node config. The child graph is
     * resolved when the node runs, so a workflow may refer to graphs loaded later (or to itself).
     */
    public static NodeFactory factory(Orchestrator child, Function<String, GraphModel> graphs) {
        return definition -> {
            String workflow = definition.configValue(WORKFLOW_KEY, String.class);
            if (workflow == null || workflow.isBlank()) {
                throw new IllegalArgumentException("Node '" + definition.id() + "' of type " + definition.type()
                        + " requires config '" + WORKFLOW_KEY + "'");
            }
            return new SubWorkflowNode(child, workflow, graphs, definition.configValue(OUTPUT_KEY, String.class));
        };
    }

    public String getWorkflowId() {
        return workflowId;
    }

    @Override
    public ExecutionCapability capability() {
        boolean blocking = child.getMode().supportsBlockingRuns();
        boolean suspending = child.getMode().supportsSuspendingRuns();
        if (blocking && suspending) return ExecutionCapability.BOTH;
        return blocking ? ExecutionCapability.SYNC : ExecutionCapability.ASYNC;
    }

    @Override
    public NodeExecutionResult runSync(StateContainer state, ExecutionContext context) {
        RunHandle run = newChildRun(state, context);
        StateContainer result = child.run(run);
        return NodeExecutionResult.of(output(state, result, run));
    }

    @Override
    public CompletionStage<NodeExecutionResult> runAsync(StateContainer state, ExecutionContext context) {
        RunHandle run = newChildRun(state, context);
        CompletableFuture<NodeExecutionResult> out = child.runAsync(run)
                .thenApply(result -> NodeExecutionResult.of(output(state, result, run)));
        // cancelling the node's future cancels the child run and its in-flight node
        out.whenComplete((result, thrown) -> {
            if (out.isCancelled() && !run.isDone()) {
                log.info("Sub-workflow cancelled by parent | executionId={} | childExecutionId={}",
                        context.getExecutionId(), run.getExecutionId());
                child.cancel(run);
            }
        });
        return out;
    }

    private RunHandle newChildRun(StateContainer state, ExecutionContext context) {
        GraphModel graph = graphs.apply(workflowId);
        RunHandle run = child.newRun(graph, state.values(), Map.of(PARENT_EXECUTION_ID, context.getExecutionId()));
        log.info("Sub-workflow started | executionId={} | childExecutionId={} | workflowId={}",
                context.getExecutionId(), run.getExecutionId(), workflowId);
        return run;
    }

    private StateContainer output(StateContainer state, StateContainer result, RunHandle run) {
        log.info("Sub-workflow completed | childExecutionId={} | workflowId={} | steps={}",
                run.getExecutionId(), workflowId, run.getStepCount());
        if (outputKey != null && !outputKey.isBlank()) {
            return state.put(outputKey, result.values());
        }
        state.replaceValues(result.values());
        return state;
    }
}
