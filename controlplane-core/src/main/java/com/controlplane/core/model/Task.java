package com.controlplane.core.model;

import com.controlplane.core.exception.InvalidStateTransitionException;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * One tracked, asynchronous execution of a workflow.
 *
 * Primary Key: id
 *
 * Invariants:
 * - id is globally unique
 * - stepStatuses has one entry per workflow step, in workflow order
 * - status only moves forward, see {@link TaskStatus#canTransitionTo}
 * - once a step has failed, every later step is SKIPPED
 * - config is attached at most once
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Task(
    String id,
    String workflowKind,
    TaskStatus status,
    List<StepStatus> stepStatuses,
    TaskConfig config,
    Instant createdAt,
    Instant completedAt
) {
    public Task {
        stepStatuses = List.copyOf(stepStatuses);
    }

    /**
     * Create a new task in PENDING state with every step pending.
     */
    public static Task create(WorkflowDefinition definition) {
        List<StepStatus> steps = definition.steps().stream()
            .map(StepStatus::pending)
            .toList();

        return new Task(
            UUID.randomUUID().toString(),
            definition.kind(),
            TaskStatus.PENDING,
            steps,
            null,
            Instant.now(),
            null
        );
    }

    public StepStatus step(int index) {
        return stepStatuses.get(index);
    }

    /**
     * The step that ended the run, if any.
     */
    public Optional<StepStatus> failedStep() {
        return stepStatuses.stream()
            .filter(s -> s.state() == StepState.FAILURE)
            .findFirst();
    }

    public boolean belongsTo(String clusterName) {
        return config != null && clusterName != null && clusterName.equals(config.clusterName());
    }

    /**
     * Attach the run configuration. Write-once.
     */
    public Task withConfig(TaskConfig runConfig) {
        if (config != null) {
            throw new IllegalStateException("Config of task " + id + " is already set");
        }
        return new Task(id, workflowKind, status, stepStatuses, runConfig, createdAt, completedAt);
    }

    /**
     * Copy safe to persist: the config keeps everything but the credentials.
     */
    public Task redacted() {
        TaskConfig safe = config != null ? config.withoutCredentials() : null;
        return new Task(id, workflowKind, status, stepStatuses, safe, createdAt, completedAt);
    }

    /**
     * Create a copy with the aggregate status moved to target.
     */
    public Task withStatus(TaskStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStateTransitionException(status, target);
        }
        Instant finished = target.isTerminal() ? Instant.now() : completedAt;
        return new Task(id, workflowKind, target, stepStatuses, config, createdAt, finished);
    }

    public Task withStepStarted(int index, Instant now) {
        requireState(index, StepState.PENDING);
        return withStep(index, step(index).started(now));
    }

    public Task withStepSucceeded(int index, Instant now) {
        requireState(index, StepState.RUNNING);
        return withStep(index, step(index).succeeded(now));
    }

    /**
     * Mark a step failed and every later step skipped.
     * A step that was never started (cancelled before it began) may fail straight from PENDING.
     */
    public Task withStepFailed(int index, String error, Instant now) {
        StepState current = step(index).state();
        if (current.isTerminal()) {
            throw new InvalidStateTransitionException("Step " + step(index).stepName(),
                current.name(), StepState.FAILURE.name());
        }

        List<StepStatus> updated = new ArrayList<>(stepStatuses);
        updated.set(index, step(index).failed(error, now));
        for (int i = index + 1; i < updated.size(); i++) {
            updated.set(i, updated.get(i).skipped());
        }
        return new Task(id, workflowKind, status, updated, config, createdAt, completedAt);
    }

    private Task withStep(int index, StepStatus stepStatus) {
        List<StepStatus> updated = new ArrayList<>(stepStatuses);
        updated.set(index, stepStatus);
        return new Task(id, workflowKind, status, updated, config, createdAt, completedAt);
    }

    private void requireState(int index, StepState expected) {
        StepStatus current = step(index);
        if (current.state() != expected) {
            throw new InvalidStateTransitionException("Step " + current.stepName(),
                current.state().name(), expected == StepState.PENDING ? "RUNNING" : "SUCCESS");
        }
    }
}
