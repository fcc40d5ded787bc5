package com.graphflow.engine;

import com.graphflow.engine.cancel.CancellationToken;
import com.graphflow.engine.checkpoint.CheckpointRecorder;
import com.graphflow.engine.merge.BranchOutcome;
import com.graphflow.engine.merge.MergeStrategy;
import com.graphflow.engine.mode.ExecutionMode;
import com.graphflow.engine.mode.ModeMismatchException;
import com.graphflow.engine.routing.Router;
import com.graphflow.graph.GraphModel;
import com.graphflow.graph.Node;
import com.graphflow.hooks.HookRegistry;
import com.graphflow.hooks.HookRunner;
import com.graphflow.hooks.NodeHookContext;
import com.graphflow.node.ExecutionContext;
import com.graphflow.node.NodeExecutionResult;
import com.graphflow.state.History;
import com.graphflow.state.HistoryEntry;
import com.graphflow.state.HistoryEntryKind;
import com.graphflow.state.Snapshot;
import com.graphflow.state.StateContainer;
import com.graphflow.state.StateDelta;
import com.graphflow.state.StateDiff;
import com.graphflow.state.checkpoint.Checkpoint;
import com.graphflow.state.checkpoint.CheckpointStore;
import com.graphflow.state.checkpoint.CursorEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Drives runs of a {@link GraphModel}: take the head of the cursor, run the node through the execution mode,
 * commit its delta to state and history, run hooks, route, repeat until the cursor is empty.
 * <p>
 * An orchestrator is configured once (mode, hooks, engine settings, checkpoint store) and may drive many
 * concurrent runs; each run owns its state exclusively. The mode is fixed for every run it drives.
 * <p>
 * Fan-out: when a node yields several successors (or declares a {@code join}), they are visited one after
 * the other in edge order, each branch running until a terminal node or the join; a node flagged
 * {@code parallel} instead runs every branch on its own copy of the state, merges the branch results with the
 * configured {@link MergeStrategy}, and continues at the join.
 */
public final class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private enum StepResult { DONE, ROUTED, STEP }

    private final ExecutionMode mode;
    private final HookRunner hooks;
    private final EngineConfig config;
    private final CheckpointRecorder checkpoints;
    private final MergeStrategy mergeStrategy;
    private final Router router = new Router();
    private final ExecutorService configuredBranchExecutor;
    private final AtomicReference<ExecutorService> defaultBranchExecutor = new AtomicReference<>();

    private Orchestrator(Builder b) {
        this.mode = Objects.requireNonNull(b.mode, "mode");
        HookRegistry registry = b.hooks != null ? b.hooks.copy() : new HookRegistry();
        registry.freeze();
        this.hooks = new HookRunner(registry);
        this.config = b.config != null ? b.config : EngineConfig.defaults();
        this.checkpoints = new CheckpointRecorder(b.checkpointStore);
        this.mergeStrategy = b.mergeStrategy != null ? b.mergeStrategy : config.getMergeStrategy().strategy();
        this.configuredBranchExecutor = b.branchExecutor;
    }

    /** Orchestrator with default settings, no hooks and no checkpoint store. */
    public Orchestrator(ExecutionMode mode) {
        this(builder().mode(mode));
    }

    public static Builder builder() {
        return new Builder();
    }

    public ExecutionMode getMode() {
        return mode;
    }

    public EngineConfig getConfig() {
        return config;
    }

    public MergeStrategy getMergeStrategy() {
        return mergeStrategy;
    }

    // ------------------------------------------------------------------
    // Run creation
    // ------------------------------------------------------------------

    public RunHandle newRun(GraphModel graph, Map<String, ?> initialValues) {
        return newRun(graph, initialValues, Map.of());
    }

    /**
     * Creates a pending run starting at the graph's entry point.
     *
     * @param parameters caller-supplied settings exposed to nodes through {@link ExecutionContext#getConfig()}
     */
    public RunHandle newRun(GraphModel graph, Map<String, ?> initialValues, Map<String, ?> parameters) {
        Objects.requireNonNull(graph, "graph");
        Map<String, ?> initial = initialValues != null ? initialValues : Map.of();
        ExecutionContext context = newContext(graph, UUID.randomUUID().toString(), parameters);
        return new RunHandle(graph, context, initial, StateContainer.of(initial),
                new History(config.getHistoryMaxLength()),
                List.of(WorkItem.pending(graph.getEntryPoint(), null)), 0);
    }

    /**
     * Rebuilds a pending run from its last checkpoint; starting it continues at the saved cursor.
     * A node that was executing when the run failed is executed again.
     *
     * @throws NoSuchElementException if no checkpoint exists for the execution
     * @throws IllegalStateException  if the checkpointed run had completed
     * @throws IllegalArgumentException if the checkpoint does not belong to this graph
     */
    public RunHandle resume(GraphModel graph, String executionId) {
        Checkpoint checkpoint = checkpoints.load(executionId)
                .orElseThrow(() -> new NoSuchElementException("No checkpoint for execution " + executionId));
        if (RunStatus.COMPLETED.name().equals(checkpoint.getStatus())) {
            throw new IllegalStateException("Execution " + executionId + " has already completed");
        }
        if (checkpoint.getWorkflowId() != null && !checkpoint.getWorkflowId().equals(graph.getWorkflowId())) {
            throw new IllegalArgumentException("Checkpoint of execution " + executionId + " belongs to workflow '"
                    + checkpoint.getWorkflowId() + "', not '" + graph.getWorkflowId() + "'");
        }
        List<WorkItem> cursor = new ArrayList<>();
        for (CursorEntry entry : checkpoint.getCursor()) {
            if (!graph.containsNode(entry.getNodeId())) {
                throw new IllegalArgumentException("Checkpoint cursor references unknown node '"
                        + entry.getNodeId() + "'");
            }
            cursor.add(WorkItem.fromEntry(entry));
        }
        History history = new History(config.getHistoryMaxLength());
        history.appendAll(checkpoint.getHistory());
        StateContainer state = new StateContainer(checkpoint.getValues(), checkpoint.getRevision(), Map.of());
        RunHandle handle = new RunHandle(graph, newContext(graph, executionId, Map.of()),
                checkpoint.getInitialValues(), state, history, cursor, checkpoint.getStepCount());
        log.info("Run resumed from checkpoint | executionId={} | workflowId={} | status={} | steps={} | cursor={}",
                executionId, graph.getWorkflowId(), checkpoint.getStatus(), checkpoint.getStepCount(),
                checkpoint.getCursor());
        return handle;
    }

    private ExecutionContext newContext(GraphModel graph, String executionId, Map<String, ?> parameters) {
        Map<String, Object> contextConfig = new LinkedHashMap<>(config.asContextConfig());
        if (parameters != null) {
            parameters.forEach((k, v) -> {
                if (k != null && v != null) contextConfig.put(k, v);
            });
        }
        return new ExecutionContext(graph.getWorkflowId(), executionId, contextConfig, Instant.now());
    }

    // ------------------------------------------------------------------
    // Blocking, suspending and streaming runs
    // ------------------------------------------------------------------

    /** Creates and runs a new run to completion. */
    public StateContainer run(GraphModel graph, Map<String, ?> initialValues) {
        return run(newRun(graph, initialValues));
    }

    /**
     * Runs to completion on the calling thread.
     *
     * @return copy of the final state
     * @throws ModeMismatchException if the mode cannot drive blocking runs, or a node does not match it
     * @throws IllegalStateException if the run was already started
     */
    public StateContainer run(RunHandle handle) {
        requireBlockingMode();
        begin(handle);
        ExecutionScope main = ExecutionScope.main(handle);
        try {
            hooks.runStart(handle.getContext());
            while (true) {
                StepResult result = stepBlocking(main);
                if (result == StepResult.DONE) break;
                if (result == StepResult.STEP) checkpointIfDue(handle);
            }
            return complete(handle);
        } catch (RuntimeException e) {
            fail(handle, e);
            throw e;
        }
    }

    public CompletableFuture<StateContainer> runAsync(RunHandle handle) {
        return runAsync(handle, null);
    }

    /**
     * Runs without blocking the caller: every node goes through the mode's suspending call site.
     * The future completes with a copy of the final state, or exceptionally with the error that ended the run.
     * Cancelling the handle cancels the in-flight node.
     *
     * @param listener optional; receives the state after each main-path step
     * @throws ModeMismatchException if the mode cannot drive suspending runs
     */
    public CompletableFuture<StateContainer> runAsync(RunHandle handle, StepListener listener) {
        if (!mode.supportsSuspendingRuns()) {
            throw ModeMismatchException.forRun(mode.name(), "suspending");
        }
        begin(handle);
        CompletableFuture<StateContainer> result = new CompletableFuture<>();
        try {
            hooks.runStart(handle.getContext());
        } catch (RuntimeException e) {
            fail(handle, e);
            result.completeExceptionally(e);
            return result;
        }
        driveAsync(ExecutionScope.main(handle), listener).whenComplete((ignored, thrown) -> {
            Throwable error = unwrap(thrown);
            if (error == null) {
                try {
                    result.complete(complete(handle));
                    return;
                } catch (RuntimeException e) {
                    error = e;
                }
            }
            fail(handle, error);
            result.completeExceptionally(error);
        });
        return result;
    }

    /**
     * Lazy, finite, single-use sequence of state copies, one after each main-path step. The run advances only
     * as elements are pulled; closing the stream before the end cancels the run. Errors that end the run are
     * thrown from the pulling operation.
     * <p>
     * Open the stream in a try-with-resources block. Pulling past the last element completes the run, but a
     * stream abandoned part way (for example by a short-circuiting operation such as {@code findFirst}) leaves
     * the handle {@link RunStatus#RUNNING} until it is closed.
     */
    public Stream<StateContainer> runStream(RunHandle handle) {
        requireBlockingMode();
        begin(handle);
        try {
            hooks.runStart(handle.getContext());
        } catch (RuntimeException e) {
            fail(handle, e);
            throw e;
        }
        ExecutionScope main = ExecutionScope.main(handle);
        Spliterator<StateContainer> steps = new Spliterators.AbstractSpliterator<>(Long.MAX_VALUE,
                Spliterator.ORDERED | Spliterator.NONNULL) {
            private boolean finished;

            @Override
            public boolean tryAdvance(Consumer<? super StateContainer> action) {
                if (finished) return false;
                StateContainer element;
                try {
                    while (true) {
                        StepResult result = stepBlocking(main);
                        if (result == StepResult.DONE) {
                            finished = true;
                            complete(handle);
                            return false;
                        }
                        if (result == StepResult.STEP) {
                            checkpointIfDue(handle);
                            element = handle.getState();
                            break;
                        }
                    }
                } catch (RuntimeException e) {
                    finished = true;
                    fail(handle, e);
                    throw e;
                }
                action.accept(element);
                return true;
            }
        };
        return StreamSupport.stream(steps, false).onClose(() -> {
            if (!handle.isDone()) {
                handle.cancel();
                fail(handle, handle.getCancellationToken().newException());
            }
        });
    }

    /** Requests cancellation of the run. */
    public void cancel(RunHandle handle) {
        handle.cancel();
    }

    // ------------------------------------------------------------------
    // Snapshots
    // ------------------------------------------------------------------

    public String snapshot(RunHandle handle) {
        return snapshot(handle, null);
    }

    /** Takes a snapshot of the run's current values and returns its id. */
    public String snapshot(RunHandle handle, String label) {
        Snapshot snapshot;
        synchronized (handle.lock) {
            snapshot = handle.snapshots().create(handle.state(), label);
        }
        log.debug("Snapshot taken | executionId={} | snapshotId={} | revision={} | label={}",
                handle.getExecutionId(), snapshot.getId(), snapshot.getRevision(), label);
        return snapshot.getId();
    }

    /**
     * Replaces the run's values with the snapshot's and appends one RESTORE history entry whose delta turns
     * the previous values into the restored ones. History is never rewritten.
     *
     * @throws com.graphflow.state.UnknownSnapshotException if the run has no such snapshot
     */
    public void restore(RunHandle handle, String snapshotId) {
        long revision;
        synchronized (handle.lock) {
            Snapshot snapshot = handle.snapshots().get(snapshotId);
            StateDelta delta = StateDiff.between(handle.state().values(), snapshot.getValues());
            revision = handle.state().replaceValues(snapshot.getValues());
            handle.history().append(new HistoryEntry(revision, null, Instant.now(), delta,
                    HistoryEntryKind.RESTORE, "snapshot=" + snapshotId));
        }
        log.info("State restored from snapshot | executionId={} | snapshotId={} | revision={}",
                handle.getExecutionId(), snapshotId, revision);
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    private void requireBlockingMode() {
        if (!mode.supportsBlockingRuns()) {
            throw ModeMismatchException.forRun(mode.name(), "blocking");
        }
    }

    private void begin(RunHandle handle) {
        if (!handle.markRunning()) {
            throw new IllegalStateException("Run " + handle.getExecutionId() + " was already started (status="
                    + handle.getStatus() + ")");
        }
        handle.getCancellationToken().cancelAfter(config.getRunTimeout());
        log.info("Run started | executionId={} | workflowId={} | mode={} | entryPoint={}",
                handle.getExecutionId(), handle.getWorkflowId(), mode.name(), handle.getGraph().getEntryPoint());
    }

    private StateContainer complete(RunHandle handle) {
        hooks.runEnd(handle.getContext(), handle.getState());
        if (!handle.finish(RunStatus.COMPLETED, null)) {
            throw handle.getCancellationToken().newException();
        }
        checkpoints.record(handle);
        log.info("Run completed | executionId={} | workflowId={} | steps={} | revision={}",
                handle.getExecutionId(), handle.getWorkflowId(), handle.getStepCount(), handle.getRevision());
        return handle.getState();
    }

    private void fail(RunHandle handle, Throwable error) {
        boolean cancelled = error instanceof CancellationException;
        if (!handle.finish(cancelled ? RunStatus.CANCELLED : RunStatus.FAILED, error)) {
            return;
        }
        if (cancelled) {
            log.info("Run cancelled | executionId={} | workflowId={} | steps={}",
                    handle.getExecutionId(), handle.getWorkflowId(), handle.getStepCount());
        } else {
            log.error("Run failed | executionId={} | workflowId={} | steps={} | error={}",
                    handle.getExecutionId(), handle.getWorkflowId(), handle.getStepCount(), error.toString());
        }
        hooks.runError(handle.getContext(), error);
        checkpoints.record(handle);
    }

    private void checkpointIfDue(RunHandle handle) {
        if (handle.checkpointDue(config.getCheckpointInterval())) {
            checkpoints.record(handle);
        }
    }

    // ------------------------------------------------------------------
    // Step logic shared by all run kinds
    // ------------------------------------------------------------------

    /** What the head of a scope's cursor asks for next. */
    private static final class StepPlan {
        final WorkItem item;
        final Node node;
        final NodeHookContext hookContext;
        final StateContainer input;
        final String vetoedBy;

        StepPlan(WorkItem item, Node node, NodeHookContext hookContext, StateContainer input, String vetoedBy) {
            this.item = item;
            this.node = node;
            this.hookContext = hookContext;
            this.input = input;
            this.vetoedBy = vetoedBy;
        }

        boolean isRoutingOnly() {
            return item.executed;
        }
    }

    /** Parallel branches waiting to run, started from an executed fan-out node. */
    private static final class FanOut {
        final WorkItem item;
        final Node node;
        final List<String> targets;

        FanOut(WorkItem item, Node node, List<String> targets) {
            this.item = item;
            this.node = node;
            this.targets = targets;
        }

        String branchStop() {
            return node.getJoin() != null ? node.getJoin() : item.stopAt;
        }
    }

    /**
     * Pops branch-stop and end-marker items, then plans the head item: claims a step number and runs the
     * before-triggers. Returns null when the scope has no work left.
     */
    private StepPlan nextStep(ExecutionScope scope) {
        RunHandle run = scope.run;
        while (true) {
            run.getCancellationToken().throwIfCancelled();
            WorkItem item = scope.cursor.peekFirst();
            if (item == null) {
                return null;
            }
            Node node = run.getGraph().node(item.nodeId);
            if (item.executed) {
                return new StepPlan(item, node, null, null, null);
            }
            if (item.reachedStop() || node.isEndMarker()) {
                scope.cursor.pollFirst();
                continue;
            }
            int step = run.claimStep(config.getMaxSteps());
            NodeHookContext hookContext = new NodeHookContext(node.getId(), node.getType(), step,
                    scope.state.values(), run.getContext());
            String vetoedBy = hooks.runBefore(hookContext).orElse(null);
            log.debug("Step planned | executionId={} | scope={} | step={} | nodeId={} | vetoedBy={}",
                    run.getExecutionId(), scope.label, step, node.getId(), vetoedBy);
            return new StepPlan(item, node, hookContext, scope.state.copy(), vetoedBy);
        }
    }

    private StepResult stepBlocking(ExecutionScope scope) {
        StepPlan plan = nextStep(scope);
        if (plan == null) {
            return StepResult.DONE;
        }
        if (plan.isRoutingOnly()) {
            routeBlocking(scope);
            return StepResult.ROUTED;
        }
        if (plan.vetoedBy != null) {
            skip(scope, plan);
        } else {
            NodeExecutionResult result;
            CancellationToken token = scope.run.getCancellationToken();
            try {
                result = mode.runNode(plan.node, plan.input, scope.run.getContext());
            } catch (RuntimeException e) {
                if (token.isCancelled()) {
                    log.info("Discarding failure of node interrupted by cancellation | executionId={} | nodeId={}"
                            + " | error={}", scope.run.getExecutionId(), plan.node.getId(), e.toString());
                    throw token.newException();
                }
                nodeFailed(scope, plan, e);
                throw e;
            }
            if (token.isCancelled()) {
                log.info("Discarding result of node completed after cancellation | executionId={} | nodeId={}",
                        scope.run.getExecutionId(), plan.node.getId());
                throw token.newException();
            }
            completeNode(scope, plan, result);
        }
        routeBlocking(scope);
        return StepResult.STEP;
    }

    private void skip(ExecutionScope scope, StepPlan plan) {
        scope.recordSkip(plan.node.getId(), plan.vetoedBy);
        scope.cursor.pollFirst();
        scope.cursor.addFirst(WorkItem.executed(plan.node.getId(), plan.item.stopAt, null));
    }

    private void nodeFailed(ExecutionScope scope, StepPlan plan, Throwable error) {
        log.debug("Node failed | executionId={} | scope={} | nodeId={} | error={}",
                scope.run.getExecutionId(), scope.label, plan.node.getId(), error.toString());
        hooks.runNodeError(plan.hookContext, error);
    }

    /** Commits the node's output, runs after-triggers, applies hook amendments. */
    private void completeNode(ExecutionScope scope, StepPlan plan, NodeExecutionResult result) {
        Node node = plan.node;
        StateDelta delta = StateDiff.between(plan.input.values(), result.getState().values());
        long revision = scope.commit(node.getId(), delta, HistoryEntryKind.NODE, null);
        scope.cursor.pollFirst();
        scope.cursor.addFirst(WorkItem.executed(node.getId(), plan.item.stopAt,
                result.getExplicitNext().orElse(null)));
        log.debug("Node completed | executionId={} | scope={} | nodeId={} | revision={} | changed={}",
                scope.run.getExecutionId(), scope.label, node.getId(), revision, delta.touchedKeys());

        hooks.runAfter(plan.hookContext.afterExecution(scope.state.values()), result);
        StateDelta amendment = plan.hookContext.pendingAmendment();
        if (!amendment.isEmpty()) {
            scope.commit(node.getId(), amendment, HistoryEntryKind.AMENDMENT, "hooks");
            log.debug("Hook amendment applied | executionId={} | nodeId={} | keys={}",
                    scope.run.getExecutionId(), node.getId(), amendment.touchedKeys());
        }
        if (scope.isMain() && config.getAutoSnapshotNodes().contains(node.getId())) {
            snapshot(scope.run, "after:" + node.getId());
        }
    }

    /**
     * Replaces the executed head item with its successors. Returns the parallel branches to run when the node
     * fans out in parallel; the head item then stays in place until the branches are joined.
     */
    private FanOut route(ExecutionScope scope) {
        WorkItem item = scope.cursor.peekFirst();
        GraphModel graph = scope.run.getGraph();
        Node node = graph.node(item.nodeId);
        List<String> targets = item.next != null
                ? item.next
                : router.resolveNext(graph, node.getId(), scope.state.values());
        for (String target : targets) {
            if (!graph.containsNode(target)) {
                throw new IllegalStateException("Node '" + node.getId() + "' selected unknown next node '"
                        + target + "'");
            }
        }
        boolean fanOut = !targets.isEmpty() && (targets.size() > 1 || node.getJoin() != null);
        if (fanOut && node.isParallel()) {
            return new FanOut(item, node, targets);
        }
        scope.cursor.pollFirst();
        if (targets.isEmpty()) {
            log.debug("Branch ended | executionId={} | scope={} | nodeId={}",
                    scope.run.getExecutionId(), scope.label, node.getId());
            return null;
        }
        if (!fanOut) {
            scope.cursor.addFirst(WorkItem.pending(targets.get(0), item.stopAt));
            return null;
        }
        String branchStop = node.getJoin() != null ? node.getJoin() : item.stopAt;
        if (node.getJoin() != null) {
            scope.cursor.addFirst(WorkItem.pending(node.getJoin(), item.stopAt));
        }
        for (int i = targets.size() - 1; i >= 0; i--) {
            scope.cursor.addFirst(WorkItem.pending(targets.get(i), branchStop));
        }
        log.debug("Sequential fan-out | executionId={} | nodeId={} | branches={} | join={}",
                scope.run.getExecutionId(), node.getId(), targets, node.getJoin());
        return null;
    }

    private void routeBlocking(ExecutionScope scope) {
        FanOut fanOut = route(scope);
        if (fanOut != null) {
            runParallelBlocking(scope, fanOut);
        }
    }

    private void driveBlocking(ExecutionScope scope) {
        while (stepBlocking(scope) != StepResult.DONE) {
            // steps until the branch ends
        }
    }

    private void runParallelBlocking(ExecutionScope scope, FanOut fanOut) {
        List<ExecutionScope> branches = openBranches(scope, fanOut);
        ExecutorService executor = branchExecutor();
        List<Future<?>> futures = new ArrayList<>(branches.size());
        for (ExecutionScope branch : branches) {
            futures.add(executor.submit(() -> driveBlocking(branch)));
        }
        RuntimeException failure = null;
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof Error err) throw err;
                if (failure == null) {
                    failure = cause instanceof RuntimeException re ? re : new CompletionException(cause);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                scope.run.cancel();
                if (failure == null) {
                    failure = scope.run.getCancellationToken().newException();
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
        joinBranches(scope, fanOut, branches);
    }

    private List<ExecutionScope> openBranches(ExecutionScope scope, FanOut fanOut) {
        List<ExecutionScope> branches = new ArrayList<>(fanOut.targets.size());
        for (String target : fanOut.targets) {
            branches.add(scope.branch(target, fanOut.branchStop()));
        }
        log.debug("Parallel fan-out | executionId={} | nodeId={} | branches={} | join={}",
                scope.run.getExecutionId(), fanOut.node.getId(), fanOut.targets, fanOut.node.getJoin());
        return branches;
    }

    /**
     * Merges completed branches into the scope. Each branch's entries are re-committed in branch order so the
     * history replays to the branch writes; if the merge strategy's result differs from that replay, one
     * MERGE entry records the difference.
     */
    private void joinBranches(ExecutionScope scope, FanOut fanOut, List<ExecutionScope> branches) {
        Map<String, Object> base = scope.state.values();
        List<BranchOutcome> outcomes = new ArrayList<>(branches.size());
        for (int i = 0; i < branches.size(); i++) {
            outcomes.add(BranchOutcome.of(fanOut.targets.get(i), base, branches.get(i).state.values()));
        }
        Map<String, Object> merged = mergeStrategy.merge(base, outcomes);
        synchronized (scope.run.lock) {
            for (ExecutionScope branch : branches) {
                for (HistoryEntry entry : branch.branchEntries()) {
                    scope.adopt(entry);
                }
            }
            StateDelta adjustment = StateDiff.between(scope.state.values(), merged);
            if (!adjustment.isEmpty()) {
                scope.commit(fanOut.node.getId(), adjustment, HistoryEntryKind.MERGE, mergeStrategy.name());
            }
        }
        scope.cursor.pollFirst();
        if (fanOut.node.getJoin() != null) {
            scope.cursor.addFirst(WorkItem.pending(fanOut.node.getJoin(), fanOut.item.stopAt));
        }
        log.debug("Branches joined | executionId={} | nodeId={} | strategy={} | revision={}",
                scope.run.getExecutionId(), fanOut.node.getId(), mergeStrategy.name(), scope.state.getRevision());
    }

    // ------------------------------------------------------------------
    // Suspending driver
    // ------------------------------------------------------------------

    private CompletableFuture<Void> driveAsync(ExecutionScope scope, StepListener listener) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        pump(scope, listener, done);
        return done;
    }

    /**
     * Runs steps while they complete synchronously; when a step suspends, resumes from its completion.
     * Keeps the stack flat for long runs of immediately-completing nodes.
     */
    private void pump(ExecutionScope scope, StepListener listener, CompletableFuture<Void> done) {
        try {
            while (true) {
                StepPlan plan = nextStep(scope);
                if (plan == null) {
                    done.complete(null);
                    return;
                }
                boolean visible = !plan.isRoutingOnly();
                CompletableFuture<Void> step = stepAsync(scope, plan);
                if (!step.isDone()) {
                    step.whenComplete((ignored, thrown) -> {
                        if (thrown != null) {
                            done.completeExceptionally(unwrap(thrown));
                            return;
                        }
                        if (visible) stepFinished(scope, listener);
                        pump(scope, listener, done);
                    });
                    return;
                }
                Throwable error = failureOf(step);
                if (error != null) {
                    done.completeExceptionally(error);
                    return;
                }
                if (visible) stepFinished(scope, listener);
            }
        } catch (RuntimeException | Error e) {
            done.completeExceptionally(e);
        }
    }

    private void stepFinished(ExecutionScope scope, StepListener listener) {
        if (!scope.isMain()) return;
        checkpointIfDue(scope.run);
        if (listener != null) {
            try {
                listener.onStep(scope.run, scope.run.getState());
            } catch (RuntimeException e) {
                log.warn("Step listener failed; continuing | executionId={}", scope.run.getExecutionId(), e);
            }
        }
    }

    private CompletableFuture<Void> stepAsync(ExecutionScope scope, StepPlan plan) {
        if (plan.isRoutingOnly()) {
            return routeAsync(scope);
        }
        if (plan.vetoedBy != null) {
            skip(scope, plan);
            return routeAsync(scope);
        }
        CancellationToken token = scope.run.getCancellationToken();
        CompletableFuture<NodeExecutionResult> call;
        try {
            call = mode.runNodeAsync(plan.node, plan.input, scope.run.getContext());
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        CompletableFuture<NodeExecutionResult> inFlight = call;
        Runnable unregister = token.onCancel(() -> inFlight.cancel(true));
        CompletableFuture<Void> out = new CompletableFuture<>();
        inFlight.whenComplete((result, thrown) -> {
            unregister.run();
            if (token.isCancelled()) {
                out.completeExceptionally(token.newException());
                return;
            }
            Throwable error = unwrap(thrown);
            if (error != null) {
                nodeFailed(scope, plan, error);
                out.completeExceptionally(error);
                return;
            }
            try {
                completeNode(scope, plan, result);
                routeAsync(scope).whenComplete((ignored, routeError) -> {
                    if (routeError != null) {
                        out.completeExceptionally(unwrap(routeError));
                    } else {
                        out.complete(null);
                    }
                });
            } catch (RuntimeException e) {
                out.completeExceptionally(e);
            }
        });
        return out;
    }

    private CompletableFuture<Void> routeAsync(ExecutionScope scope) {
        FanOut fanOut;
        try {
            fanOut = route(scope);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (fanOut == null) {
            return CompletableFuture.completedFuture(null);
        }
        List<ExecutionScope> branches = openBranches(scope, fanOut);
        List<CompletableFuture<Void>> futures = branches.stream()
                .map(branch -> driveAsync(branch, null))
                .collect(Collectors.toList());
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                .handle((ignored, thrown) -> {
                    for (CompletableFuture<Void> future : futures) {
                        Throwable error = failureOf(future);
                        if (error != null) {
                            throw error instanceof RuntimeException re ? re : new CompletionException(error);
                        }
                    }
                    joinBranches(scope, fanOut, branches);
                    return null;
                });
    }

    private static Throwable failureOf(CompletableFuture<?> future) {
        if (!future.isCompletedExceptionally()) {
            return null;
        }
        try {
            future.join();
            return null;
        } catch (CompletionException e) {
            return unwrap(e);
        } catch (CancellationException e) {
            return e;
        }
    }

    private static Throwable unwrap(Throwable t) {
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    // ------------------------------------------------------------------
    // Branch executor
    // ------------------------------------------------------------------

    private ExecutorService branchExecutor() {
        if (configuredBranchExecutor != null) {
            return configuredBranchExecutor;
        }
        ExecutorService existing = defaultBranchExecutor.get();
        if (existing != null) {
            return existing;
        }
        ExecutorService created = Executors.newCachedThreadPool(new BranchThreadFactory());
        if (defaultBranchExecutor.compareAndSet(null, created)) {
            return created;
        }
        created.shutdown();
        return defaultBranchExecutor.get();
    }

    /** Stops the default branch executor, if one was created. A configured executor is left to its owner. */
    public void shutdown() {
        ExecutorService executor = defaultBranchExecutor.getAndSet(null);
        if (executor != null) {
            executor.shutdown();
        }
    }

    private static final class BranchThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "graphflow-branch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }

    public static final class Builder {
        private ExecutionMode mode;
        private HookRegistry hooks;
        private EngineConfig config;
        private CheckpointStore checkpointStore;
        private MergeStrategy mergeStrategy;
        private ExecutorService branchExecutor;

        public Builder mode(ExecutionMode mode) {
            this.mode = mode;
            return this;
        }

        /** Hooks for every run; the registry is copied and frozen when the orchestrator is built. */
        public Builder hooks(HookRegistry hooks) {
            this.hooks = hooks;
            return this;
        }

        public Builder config(EngineConfig config) {
            this.config = config;
            return this;
        }

        public Builder checkpointStore(CheckpointStore checkpointStore) {
            this.checkpointStore = checkpointStore;
            return this;
        }

        /** Overrides the strategy selected by {@link EngineConfig#getMergeStrategy()}. */
        public Builder mergeStrategy(MergeStrategy mergeStrategy) {
            this.mergeStrategy = mergeStrategy;
            return this;
        }

        /**
         * Executor for parallel branches of blocking runs. Nested parallel fan-outs wait on it from its own
         * threads, so it must not be a small fixed pool. Default: a cached pool of daemon threads.
         */
        public Builder branchExecutor(ExecutorService branchExecutor) {
            this.branchExecutor = branchExecutor;
            return this;
        }

        public Orchestrator build() {
            return new Orchestrator(this);
        }
    }
}
