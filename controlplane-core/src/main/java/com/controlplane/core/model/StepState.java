package com.controlplane.core.model;

/**
 * State of a single step within a task.
 */
public enum StepState {
    PENDING,
    RUNNING,
    SUCCESS,
    FAILURE,

    /**
     * An earlier step failed; this step was never started.
     */
    SKIPPED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILURE || this == SKIPPED;
    }
}
