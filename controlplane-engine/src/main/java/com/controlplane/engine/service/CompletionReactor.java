package com.controlplane.engine.service;

import com.controlplane.core.exception.ControlPlaneException;
import com.controlplane.core.model.RetryPolicy;
import com.controlplane.core.model.TaskOutcome;
import com.controlplane.engine.execution.TaskRun;
import com.controlplane.engine.metrics.TaskMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs follow-up actions (cluster record mutation, cascading cleanup) once a task succeeds.
 *
 * Actions run off the engine threads and are retried with backoff according to the
 * configured {@link RetryPolicy}. A reaction that keeps failing is logged and counted;
 * the task record it reacts to is left untouched.
 */
public class CompletionReactor {

    private static final Logger log = LoggerFactory.getLogger(CompletionReactor.class);

    /**
     * A follow-up action. Must be safe to run more than once.
     */
    @FunctionalInterface
    public interface Reaction {
        void apply(TaskOutcome outcome);
    }

    private final RetryPolicy retryPolicy;
    private final ScheduledExecutorService scheduler;
    private final TaskMetrics metrics;

    public CompletionReactor(RetryPolicy retryPolicy, ScheduledExecutorService scheduler, TaskMetrics metrics) {
        this.retryPolicy = retryPolicy;
        this.scheduler = scheduler;
        this.metrics = metrics;
    }

    /**
     * Register an action to run when the task succeeds.
     *
     * @param run The run to react to
     * @param reaction Name used in logs and metrics, e.g. "remove-node"
     * @param action The action
     * @return Completes with true once the action ran, false if the task failed or retries ran out
     */
    public CompletableFuture<Boolean> onSuccess(TaskRun run, String reaction, Reaction action) {
        CompletableFuture<Boolean> result = new CompletableFuture<>();
        run.completion().thenAccept(outcome -> {
            if (!outcome.succeeded()) {
                log.info("Skipping reaction {} for task {}: task ended {} at step {}",
                    reaction, outcome.taskId(), outcome.status(), outcome.failedStep());
                result.complete(false);
                return;
            }
            schedule(outcome, reaction, action, 1, Duration.ZERO, result);
        });
        return result;
    }

    private void schedule(TaskOutcome outcome, String reaction, Reaction action, int attempt,
                          Duration delay, CompletableFuture<Boolean> result) {
        try {
            scheduler.schedule(() -> attempt(outcome, reaction, action, attempt, result),
                delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.error("Reaction {} for task {} dropped: scheduler is shut down", reaction, outcome.taskId(), e);
            metrics.reactionFailed(reaction);
            result.complete(false);
        }
    }

    private void attempt(TaskOutcome outcome, String reaction, Reaction action, int attempt,
                         CompletableFuture<Boolean> result) {
        try {
            action.apply(outcome);
            log.info("Reaction {} for task {} applied (attempt {})", reaction, outcome.taskId(), attempt);
            result.complete(true);
        } catch (RuntimeException e) {
            String errorCode = e instanceof ControlPlaneException cpe ? cpe.getErrorCode() : null;

            if (retryPolicy.shouldRetry(errorCode) && retryPolicy.hasMoreAttempts(attempt)) {
                Duration backoff = retryPolicy.computeBackoff(attempt);
                log.warn("Reaction {} for task {} failed (attempt {}/{}), retrying in {}ms: {}",
                    reaction, outcome.taskId(), attempt, retryPolicy.maxAttempts(), backoff.toMillis(),
                    e.getMessage());
                schedule(outcome, reaction, action, attempt + 1, backoff, result);
                return;
            }

            log.error("Reaction {} for task {} gave up after {} attempt(s)", reaction, outcome.taskId(), attempt, e);
            metrics.reactionFailed(reaction);
            result.complete(false);
        }
    }

    public void shutdown() {
        scheduler.shutdown();
    }
}
