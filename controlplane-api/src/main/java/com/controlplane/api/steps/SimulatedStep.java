package com.controlplane.api.steps;

import com.controlplane.core.model.TaskConfig;
import com.controlplane.core.step.Step;
import com.controlplane.core.step.StepContext;
import com.controlplane.core.step.StepException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Function;

/**
 * Stand-in for a provider operation: logs what it would do, takes some time, and
 * optionally fails. Cancellation is honoured while it waits.
 */
public class SimulatedStep implements Step {

    private static final Logger log = LoggerFactory.getLogger(SimulatedStep.class);

    private final String name;
    private final Function<TaskConfig, String> description;
    private final Duration delay;
    private final boolean failing;

    public SimulatedStep(String name, Function<TaskConfig, String> description, Duration delay, boolean failing) {
        this.name = name;
        this.description = description;
        this.delay = delay;
        this.failing = failing;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void run(StepContext context) throws StepException, InterruptedException {
        String action = description.apply(context.getConfig());
        log.info("[{}] {}", context.getTaskId(), action);
        context.log("%s", action);

        // sleep in slices so a cancelled token is noticed even if the interrupt is lost
        long remaining = delay.toMillis();
        while (remaining > 0) {
            context.checkCancelled();
            long slice = Math.min(remaining, 100);
            Thread.sleep(slice);
            remaining -= slice;
        }
        context.checkCancelled();

        if (failing) {
            log.warn("[{}] SIMULATED FAILURE: {}", context.getTaskId(), name);
            throw StepException.failed("simulated failure of " + name);
        }
        context.log("done");
    }
}
