package com.controlplane.engine.execution;

import com.controlplane.core.model.TaskOutcome;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Handle on one asynchronous task run.
 * The completion future is completed exactly once, with the terminal outcome, and never exceptionally.
 * Nobody has to observe it: the engine makes progress whether or not a caller waits.
 */
public final class TaskRun {

    private final String taskId;
    private final CompletableFuture<TaskOutcome> completion = new CompletableFuture<>();

    TaskRun(String taskId) {
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }

    /**
     * One-shot completion signal. Each call returns a fresh dependent copy,
     * so a caller completing or cancelling its copy cannot affect the run.
     */
    public CompletableFuture<TaskOutcome> completion() {
        return completion.copy();
    }

    public boolean isDone() {
        return completion.isDone();
    }

    /**
     * Block until the run finishes.
     */
    public TaskOutcome await(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Task run " + taskId + " completed exceptionally", e.getCause());
        }
    }

    boolean complete(TaskOutcome outcome) {
        return completion.complete(outcome);
    }
}
