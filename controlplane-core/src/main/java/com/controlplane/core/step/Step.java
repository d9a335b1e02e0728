package com.controlplane.core.step;

/**
 * A single fallible unit of remote work, such as deleting a VM through a provider API.
 * Implementations are provider- and action-specific and should be as idempotent as the provider allows.
 */
public interface Step {

    /**
     * Name workflow definitions refer to this step by.
     */
    String name();

    /**
     * Execute the step.
     *
     * @param context Config snapshot, output sink and cancellation token of the running task
     * @throws StepException if the step fails
     * @throws InterruptedException if the run is cancelled while the step is blocked
     */
    void run(StepContext context) throws StepException, InterruptedException;
}
