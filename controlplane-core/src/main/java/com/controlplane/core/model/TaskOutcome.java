package com.controlplane.core.model;

/**
 * Terminal result of one task run, delivered once through the run's completion future.
 */
public record TaskOutcome(
    String taskId,
    String workflowKind,
    TaskStatus status,
    String failedStep,
    String errorCode,
    String errorMessage
) {
    public static TaskOutcome success(Task task) {
        return new TaskOutcome(task.id(), task.workflowKind(), TaskStatus.SUCCESS, null, null, null);
    }

    public static TaskOutcome failure(Task task, String failedStep, String errorCode, String errorMessage) {
        return new TaskOutcome(task.id(), task.workflowKind(), TaskStatus.FAILURE,
            failedStep, errorCode, errorMessage);
    }

    public boolean succeeded() {
        return status == TaskStatus.SUCCESS;
    }
}
