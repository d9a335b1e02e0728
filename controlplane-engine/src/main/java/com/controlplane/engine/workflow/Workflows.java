package com.controlplane.engine.workflow;

import com.controlplane.core.model.CloudProvider;
import com.controlplane.core.model.Intent;
import com.controlplane.core.model.WorkflowDefinition;

/**
 * Workflow kinds and step names known to the control plane.
 */
public final class Workflows {

    public static final String DIGITALOCEAN_DELETE_CLUSTER = "DigitalOceanDeleteCluster";
    public static final String DIGITALOCEAN_DELETE_NODE = "DigitalOceanDeleteNode";
    public static final String DIGITALOCEAN_PROVISION_NODE = "DigitalOceanProvisionNode";

    public static final String DO_DELETE_MACHINES = "do_delete_machines";
    public static final String DO_DELETE_KEYS = "do_delete_keys";
    public static final String DO_DETACH_LOAD_BALANCER = "do_detach_load_balancer";
    public static final String DO_DELETE_MACHINE = "do_delete_machine";
    public static final String DO_CREATE_MACHINE = "do_create_machine";
    public static final String REMOVE_FROM_INVENTORY = "remove_from_inventory";
    public static final String INSTALL_DOCKER = "install_docker";
    public static final String INSTALL_KUBELET = "install_kubelet";
    public static final String JOIN_CLUSTER = "join_cluster";

    private Workflows() {
    }

    /**
     * The table the control plane starts with.
     */
    public static WorkflowRegistry defaultRegistry() {
        return WorkflowRegistry.builder()
            .define(WorkflowDefinition.builder(DIGITALOCEAN_DELETE_CLUSTER)
                .step(DO_DELETE_MACHINES)
                .step(DO_DELETE_KEYS)
                .description("Delete every droplet and the ssh keys of a cluster")
                .build())
            .define(WorkflowDefinition.builder(DIGITALOCEAN_DELETE_NODE)
                .step(DO_DETACH_LOAD_BALANCER)
                .step(DO_DELETE_MACHINE)
                .step(REMOVE_FROM_INVENTORY)
                .description("Drain a worker droplet out of a cluster and delete it")
                .build())
            .define(WorkflowDefinition.builder(DIGITALOCEAN_PROVISION_NODE)
                .step(DO_CREATE_MACHINE)
                .step(INSTALL_DOCKER)
                .step(INSTALL_KUBELET)
                .step(JOIN_CLUSTER)
                .description("Create a droplet and join it to a cluster as a worker")
                .build())
            .map(CloudProvider.DIGITALOCEAN, Intent.DELETE_CLUSTER, DIGITALOCEAN_DELETE_CLUSTER)
            .map(CloudProvider.DIGITALOCEAN, Intent.DELETE_NODE, DIGITALOCEAN_DELETE_NODE)
            .map(CloudProvider.DIGITALOCEAN, Intent.PROVISION_NODE, DIGITALOCEAN_PROVISION_NODE)
            .build();
    }
}
