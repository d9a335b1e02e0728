package com.controlplane.api.steps;

import com.controlplane.core.model.TaskConfig;
import com.controlplane.core.step.Step;
import com.controlplane.engine.workflow.Workflows;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.function.Function;

/**
 * Registers a simulated implementation for every step the built-in workflows use.
 * Disable with {@code controlplane.simulation.enabled=false} once real provider steps are on the classpath.
 */
@Configuration
@EnableConfigurationProperties(SimulationProperties.class)
@ConditionalOnProperty(prefix = "controlplane.simulation", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SimulatedStepsConfiguration {

    private final SimulationProperties properties;

    public SimulatedStepsConfiguration(SimulationProperties properties) {
        this.properties = properties;
    }

    private Step simulated(String name, Function<TaskConfig, String> description) {
        return new SimulatedStep(name, description, properties.stepDelay(),
            properties.failingSteps().contains(name));
    }

    private static String node(TaskConfig config) {
        return config.node() != null ? config.node().name() : "<none>";
    }

    // ========== Delete cluster ==========

    @Bean
    public Step doDeleteMachines() {
        return simulated(Workflows.DO_DELETE_MACHINES,
            c -> "Deleting all droplets of cluster " + c.clusterName());
    }

    @Bean
    public Step doDeleteKeys() {
        return simulated(Workflows.DO_DELETE_KEYS,
            c -> "Deleting ssh keys of cluster " + c.clusterName());
    }

    // ========== Delete node ==========

    @Bean
    public Step doDetachLoadBalancer() {
        return simulated(Workflows.DO_DETACH_LOAD_BALANCER,
            c -> "Detaching " + node(c) + " from the load balancer");
    }

    @Bean
    public Step doDeleteMachine() {
        return simulated(Workflows.DO_DELETE_MACHINE,
            c -> "Deleting droplet " + node(c));
    }

    @Bean
    public Step removeFromInventory() {
        return simulated(Workflows.REMOVE_FROM_INVENTORY,
            c -> "Removing " + node(c) + " from the inventory of " + c.clusterName());
    }

    // ========== Provision node ==========

    @Bean
    public Step doCreateMachine() {
        return simulated(Workflows.DO_CREATE_MACHINE,
            c -> "Creating droplet " + node(c) + " of size "
                + (c.nodeProfile() != null ? c.nodeProfile().size() : "default"));
    }

    @Bean
    public Step installDocker() {
        return simulated(Workflows.INSTALL_DOCKER,
            c -> "Installing docker " + (c.profile() != null ? c.profile().dockerVersion() : "") + " on " + node(c));
    }

    @Bean
    public Step installKubelet() {
        return simulated(Workflows.INSTALL_KUBELET,
            c -> "Installing kubelet " + (c.profile() != null ? c.profile().k8sVersion() : "") + " on " + node(c));
    }

    @Bean
    public Step joinCluster() {
        return simulated(Workflows.JOIN_CLUSTER,
            c -> "Joining " + node(c) + " to master " + (c.master() != null ? c.master().name() : "<none>"));
    }
}
