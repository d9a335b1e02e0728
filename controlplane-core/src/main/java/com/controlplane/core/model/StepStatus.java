package com.controlplane.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Recorded progress of one step of a task.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StepStatus(
    String stepName,
    StepState state,
    String errorMessage,
    Instant startedAt,
    Instant finishedAt
) {
    public static StepStatus pending(String stepName) {
        return new StepStatus(stepName, StepState.PENDING, null, null, null);
    }

    public StepStatus started(Instant now) {
        return new StepStatus(stepName, StepState.RUNNING, null, now, null);
    }

    public StepStatus succeeded(Instant now) {
        return new StepStatus(stepName, StepState.SUCCESS, null, startedAt, now);
    }

    public StepStatus failed(String error, Instant now) {
        return new StepStatus(stepName, StepState.FAILURE, error, startedAt, now);
    }

    public StepStatus skipped() {
        return new StepStatus(stepName, StepState.SKIPPED, null, null, null);
    }
}
