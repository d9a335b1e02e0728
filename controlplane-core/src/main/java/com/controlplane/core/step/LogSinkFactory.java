package com.controlplane.core.step;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Opens the destination step output of a task is written to.
 */
@FunctionalInterface
public interface LogSinkFactory {

    /**
     * Open a sink for one task run. The engine closes it when the run ends.
     */
    OutputStream open(String taskId) throws IOException;
}
