package com.controlplane.core.step;

import com.controlplane.core.model.TaskConfig;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Context provided to a step while it runs.
 */
public class StepContext {

    private final String taskId;
    private final String workflowKind;
    private final String stepName;
    private final TaskConfig config;
    private final OutputStream output;
    private final CancellationToken cancellationToken;

    public StepContext(
            String taskId,
            String workflowKind,
            String stepName,
            TaskConfig config,
            OutputStream output,
            CancellationToken cancellationToken) {
        this.taskId = taskId;
        this.workflowKind = workflowKind;
        this.stepName = stepName;
        this.config = config;
        this.output = output;
        this.cancellationToken = cancellationToken;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getWorkflowKind() {
        return workflowKind;
    }

    public String getStepName() {
        return stepName;
    }

    /**
     * The config snapshot the task was started with.
     */
    public TaskConfig getConfig() {
        return config;
    }

    /**
     * Raw sink for step output, e.g. streamed remote command output.
     */
    public OutputStream getOutput() {
        return output;
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    /**
     * Write one line to the task log, prefixed with the step name.
     */
    public void log(String format, Object... args) throws StepException {
        String line = "[" + stepName + "] " + String.format(format, args) + System.lineSeparator();
        try {
            synchronized (output) {
                output.write(line.getBytes(StandardCharsets.UTF_8));
                output.flush();
            }
        } catch (IOException e) {
            throw new StepException(StepException.STEP_FAILED, "write task log: " + e.getMessage(), e);
        }
    }

    /**
     * Fail fast if the task was cancelled. Long-running steps call this between remote calls.
     */
    public void checkCancelled() throws StepException {
        if (cancellationToken.isCancelled()) {
            throw StepException.cancelled(cancellationToken.reason().orElse("unknown"));
        }
    }
}
