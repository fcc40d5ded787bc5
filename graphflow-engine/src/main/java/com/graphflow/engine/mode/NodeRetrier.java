package com.graphflow.engine.mode;

import com.graphflow.engine.cancel.RunCancelledException;
import com.graphflow.graph.Node;
import com.graphflow.node.ErrorInfo;
import com.graphflow.node.ExecutionContext;
import com.graphflow.node.NodeExecutionResult;
import com.graphflow.node.RetryPolicy;
import com.graphflow.state.StateContainer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Applies a node's own {@link RetryPolicy} around one entry point. Each attempt gets a fresh copy of the
 * input state. Only called by the modes after the capability check.
 */
final class NodeRetrier {

    private static final Logger log = LoggerFactory.getLogger(NodeRetrier.class);

    private NodeRetrier() {
    }

    static NodeExecutionResult runBlocking(Node node, StateContainer input, ExecutionContext context) {
        RetryPolicy policy = node.getImplementation().retryPolicy();
        for (int attempt = 1; ; attempt++) {
            if (attempt > 1 && context.isCancelled()) {
                log.info("Retries stopped by cancellation | executionId={} | nodeId={} | attempts={}",
                        context.getExecutionId(), node.getId(), attempt - 1);
                throw new RunCancelledException(context.getExecutionId(), false);
            }
            String failure;
            try {
                NodeExecutionResult result = node.getImplementation().runSync(input.copy(), context);
                if (result == null) {
                    throw NodeExecutionException.nullResult(node.getId(), attempt);
                }
                if (result.isSuccess()) {
                    return result;
                }
                ErrorInfo error = result.getError().get();
                if (!policy.shouldRetry(attempt, error)) {
                    throw new NodeExecutionException(node.getId(), attempt, error);
                }
                failure = error.toString();
            } catch (NodeExecutionException e) {
                throw e;
            } catch (RuntimeException e) {
                if (!policy.shouldRetry(attempt, e)) {
                    throw new NodeExecutionException(node.getId(), attempt, e);
                }
                failure = e.toString();
            }
            logRetry(node, context, attempt, failure);
            sleep(policy.delayBefore(attempt + 1), context);
        }
    }

    static CompletableFuture<NodeExecutionResult> runAsync(Node node, StateContainer input, ExecutionContext context) {
        CompletableFuture<NodeExecutionResult> out = new CompletableFuture<>();
        attempt(node, input, context, 1, out);
        return out;
    }

    private static void attempt(Node node, StateContainer input, ExecutionContext context, int attempt,
                                CompletableFuture<NodeExecutionResult> out) {
        if (out.isDone()) return;
        CompletableFuture<NodeExecutionResult> call;
        try {
            CompletionStage<NodeExecutionResult> stage = node.getImplementation().runAsync(input.copy(), context);
            call = stage != null ? stage.toCompletableFuture()
                    : CompletableFuture.failedFuture(NodeExecutionException.nullResult(node.getId(), attempt));
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        CompletableFuture<NodeExecutionResult> inFlight = call;
        out.whenComplete((r, t) -> {
            if (out.isCancelled()) inFlight.cancel(true);
        });
        inFlight.whenComplete((result, thrown) -> {
            if (out.isDone()) return;
            if (context.isCancelled()) {
                out.completeExceptionally(new RunCancelledException(context.getExecutionId(), false));
                return;
            }
            RetryPolicy policy = node.getImplementation().retryPolicy();
            Throwable error = unwrap(thrown);
            if (error == null && result == null) {
                error = NodeExecutionException.nullResult(node.getId(), attempt);
            }
            if (error instanceof NodeExecutionException || error instanceof CancellationException) {
                out.completeExceptionally(error);
                return;
            }
            if (error == null && result.isSuccess()) {
                out.complete(result);
                return;
            }
            boolean retry;
            String reason;
            if (error != null) {
                retry = policy.shouldRetry(attempt, error);
                reason = error.toString();
            } else {
                ErrorInfo reported = result.getError().get();
                retry = policy.shouldRetry(attempt, reported);
                reason = reported.toString();
            }
            if (!retry) {
                out.completeExceptionally(error != null
                        ? new NodeExecutionException(node.getId(), attempt, error)
                        : new NodeExecutionException(node.getId(), attempt, result.getError().get()));
                return;
            }
            logRetry(node, context, attempt, reason);
            delayed(policy.delayBefore(attempt + 1)).execute(() -> attempt(node, input, context, attempt + 1, out));
        });
    }

    private static Executor delayed(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return Runnable::run;
        }
        return CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static void sleep(Duration delay, ExecutionContext context) {
        if (delay.isZero() || delay.isNegative()) return;
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RunCancelledException(context.getExecutionId(), false);
        }
    }

    private static void logRetry(Node node, ExecutionContext context, int attempt, String reason) {
        log.warn("Node attempt failed; retrying | executionId={} | nodeId={} | attempt={} | error={}",
                context.getExecutionId(), node.getId(), attempt, reason);
    }

    static Throwable unwrap(Throwable t) {
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
