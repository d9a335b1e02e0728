package com.controlplane.engine.lifecycle;

import com.controlplane.engine.execution.TaskEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Drains the task engine on shutdown.
 *
 * On shutdown:
 * 1. Stops accepting new runs
 * 2. Waits up to the grace period for in-flight runs
 * 3. Interrupts whatever is left; the step in progress fails as cancelled and the
 *    task is recorded as failed
 */
public class EngineShutdownHandler {

    private static final Logger log = LoggerFactory.getLogger(EngineShutdownHandler.class);

    static final Duration FORCED_STOP_WAIT = Duration.ofSeconds(5);

    private final TaskEngine taskEngine;
    private final ExecutorService taskExecutor;
    private final ExecutorService stepExecutor;
    private final Duration grace;

    public EngineShutdownHandler(TaskEngine taskEngine, ExecutorService taskExecutor,
                                 ExecutorService stepExecutor, Duration grace) {
        this.taskEngine = taskEngine;
        this.taskExecutor = taskExecutor;
        this.stepExecutor = stepExecutor;
        this.grace = grace;
    }

    /**
     * Runs before any bean is destroyed, while the stores are still usable.
     */
    @EventListener(ContextClosedEvent.class)
    @Order(0)
    public void onShutdown() {
        drain();
    }

    /**
     * @return true if every run finished within the grace period
     */
    public boolean drain() {
        taskExecutor.shutdown();
        log.info("Draining {} active task run(s), grace {}", taskEngine.activeRuns(), grace);
        try {
            if (taskExecutor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                stepExecutor.shutdown();
                log.info("Task engine drained");
                return true;
            }

            log.warn("{} task run(s) still active after {}, interrupting", taskEngine.activeRuns(), grace);
            stepExecutor.shutdownNow();
            taskExecutor.shutdownNow();
            if (!taskExecutor.awaitTermination(FORCED_STOP_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.error("{} task run(s) did not stop after interruption", taskEngine.activeRuns());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stepExecutor.shutdownNow();
            taskExecutor.shutdownNow();
            log.warn("Interrupted while draining the task engine");
        }
        return false;
    }
}
