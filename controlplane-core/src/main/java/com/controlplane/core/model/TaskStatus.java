package com.controlplane.core.model;

/**
 * Aggregate lifecycle states of a task.
 * Transitions are monotonic: PENDING -> RUNNING -> SUCCESS | FAILURE.
 */
public enum TaskStatus {
    /**
     * Task created and persisted, not yet started.
     * Transitions: -> RUNNING
     */
    PENDING,

    /**
     * Steps are being executed.
     * Transitions: -> SUCCESS, FAILURE
     */
    RUNNING,

    /**
     * Every step succeeded. Terminal state.
     */
    SUCCESS,

    /**
     * A step failed or the run was cancelled. Terminal state.
     */
    FAILURE;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILURE;
    }

    /**
     * Check if this state can transition to the target state.
     */
    public boolean canTransitionTo(TaskStatus target) {
        return switch (this) {
            case PENDING -> target == RUNNING;
            case RUNNING -> target == SUCCESS || target == FAILURE;
            case SUCCESS, FAILURE -> false;
        };
    }
}
