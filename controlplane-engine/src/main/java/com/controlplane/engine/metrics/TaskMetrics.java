package com.controlplane.engine.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Metrics for task execution and completion reactions.
 *
 * Metrics exposed:
 * - Tasks started and finished, by workflow kind and outcome
 * - Currently running tasks
 * - Step latency, by workflow kind, step and outcome
 * - Completion reactions that gave up
 */
public class TaskMetrics implements MeterBinder {

    public static final String TASKS_STARTED = "controlplane.tasks.started";
    public static final String TASKS_FINISHED = "controlplane.tasks.finished";
    public static final String TASKS_RUNNING = "controlplane.tasks.running";
    public static final String STEP_DURATION = "controlplane.step.duration";
    public static final String REACTIONS_FAILED = "controlplane.reactions.failed";

    private final AtomicInteger running = new AtomicInteger(0);
    private volatile MeterRegistry registry = Metrics.globalRegistry;

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder(TASKS_RUNNING, running, AtomicInteger::get)
            .description("Number of tasks currently executing steps")
            .register(registry);
    }

    public void taskStarted(String workflowKind) {
        Counter.builder(TASKS_STARTED)
            .tag("workflow", workflowKind)
            .description("Total tasks started")
            .register(registry)
            .increment();
        running.incrementAndGet();
    }

    public void taskFinished(String workflowKind, String status, Duration duration) {
        Counter.builder(TASKS_FINISHED)
            .tag("workflow", workflowKind)
            .tag("status", status)
            .description("Total tasks that reached a terminal state")
            .register(registry)
            .increment();

        Timer.builder("controlplane.task.duration")
            .tag("workflow", workflowKind)
            .tag("status", status)
            .description("Task execution duration")
            .register(registry)
            .record(duration);
        running.decrementAndGet();
    }

    public void stepFinished(String workflowKind, String step, String outcome, Duration duration) {
        Timer.builder(STEP_DURATION)
            .tag("workflow", workflowKind)
            .tag("step", step)
            .tag("outcome", outcome)
            .description("Step execution duration")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry)
            .record(duration);
    }

    public void reactionFailed(String reaction) {
        Counter.builder(REACTIONS_FAILED)
            .tag("reaction", reaction)
            .description("Completion reactions abandoned after retries")
            .register(registry)
            .increment();
    }

    public int runningTasks() {
        return running.get();
    }
}
