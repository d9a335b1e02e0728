package com.controlplane.engine.logging;

import org.slf4j.MDC;

/**
 * MDC helper that tags control plane log lines with the task and cluster they concern.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forTask(taskId, workflowKind, clusterName)) {
 *     log.info("Running step"); // includes taskId, workflowKind, cluster
 * }
 * </pre>
 */
public final class LoggingContext implements AutoCloseable {

    public static final String TASK_ID = "taskId";
    public static final String WORKFLOW_KIND = "workflowKind";
    public static final String STEP = "step";
    public static final String CLUSTER = "cluster";

    private final String[] keys;

    private LoggingContext(String... keys) {
        this.keys = keys;
    }

    /**
     * Create a logging context for one task run.
     */
    public static LoggingContext forTask(String taskId, String workflowKind, String clusterName) {
        putIfPresent(TASK_ID, taskId);
        putIfPresent(WORKFLOW_KIND, workflowKind);
        putIfPresent(CLUSTER, clusterName);
        return new LoggingContext(TASK_ID, WORKFLOW_KIND, CLUSTER);
    }

    /**
     * Create a logging context for a single step. Nest inside {@link #forTask}.
     */
    public static LoggingContext forStep(String stepName) {
        putIfPresent(STEP, stepName);
        return new LoggingContext(STEP);
    }

    /**
     * Create a logging context for cluster-level operations.
     */
    public static LoggingContext forCluster(String clusterName) {
        putIfPresent(CLUSTER, clusterName);
        return new LoggingContext(CLUSTER);
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
    }
}
