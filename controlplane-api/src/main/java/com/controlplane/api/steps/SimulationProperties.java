package com.controlplane.api.steps;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.Set;

/**
 * Settings of the simulated provider steps, under {@code controlplane.simulation}.
 *
 * @param stepDelay How long each simulated step takes
 * @param failingSteps Step names that always fail, to exercise failure handling
 */
@ConfigurationProperties(prefix = "controlplane.simulation")
public record SimulationProperties(
    @DefaultValue("true") boolean enabled,
    @DefaultValue("2s") Duration stepDelay,
    Set<String> failingSteps
) {
    public SimulationProperties {
        failingSteps = failingSteps == null ? Set.of() : Set.copyOf(failingSteps);
    }
}
