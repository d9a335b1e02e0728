package com.controlplane.engine.workflow;

import com.controlplane.core.step.Step;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves step names used by workflow definitions to their implementations.
 */
public final class StepRegistry {

    private static final Logger log = LoggerFactory.getLogger(StepRegistry.class);

    private final Map<String, Step> steps;

    public StepRegistry(Collection<? extends Step> implementations) {
        Map<String, Step> byName = new LinkedHashMap<>();
        for (Step step : implementations) {
            Step previous = byName.putIfAbsent(step.name(), step);
            if (previous != null) {
                throw new IllegalStateException(String.format(
                    "Step %s registered twice: %s and %s",
                    step.name(), previous.getClass().getName(), step.getClass().getName()));
            }
        }
        this.steps = Map.copyOf(byName);
        log.info("Registered {} steps: {}", steps.size(), byName.keySet());
    }

    public Optional<Step> find(String stepName) {
        return Optional.ofNullable(steps.get(stepName));
    }

    /**
     * Step names from the list that have no implementation.
     */
    public List<String> missing(List<String> stepNames) {
        return stepNames.stream()
            .filter(name -> !steps.containsKey(name))
            .toList();
    }
}
