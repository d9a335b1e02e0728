package com.controlplane.core.model;

import com.controlplane.core.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Snapshot of everything the steps of one task need.
 * Captured when the task is started; later changes to the cluster record do not affect it.
 *
 * Invariants:
 * - clusterName is not blank
 * - node is set for node-scoped workflows (delete node, provision node)
 * - credentials are never persisted, see {@link #withoutCredentials()}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskConfig(
    String clusterName,
    String cloudAccountName,
    CloudProvider provider,
    Map<String, String> credentials,
    ClusterProfile profile,
    NodeSpec master,
    NodeSpec node,
    NodeProfile nodeProfile
) {
    public TaskConfig {
        credentials = credentials == null ? Map.of() : Map.copyOf(credentials);
    }

    /**
     * Config for a cluster-scoped workflow.
     */
    public static TaskConfig forCluster(Kube kube, CloudAccount account) {
        return new TaskConfig(
            kube.name(),
            kube.accountName(),
            account.provider(),
            account.credentials(),
            kube.profile(),
            null,
            null,
            null
        );
    }

    public TaskConfig withNode(NodeSpec node) {
        return new TaskConfig(clusterName, cloudAccountName, provider, credentials,
            profile, master, node, nodeProfile);
    }

    public TaskConfig withNodeProfile(NodeProfile nodeProfile) {
        return new TaskConfig(clusterName, cloudAccountName, provider, credentials,
            profile, master, node, nodeProfile);
    }

    public TaskConfig withMaster(NodeSpec master) {
        return new TaskConfig(clusterName, cloudAccountName, provider, credentials,
            profile, master, node, nodeProfile);
    }

    /**
     * Check the fields every workflow depends on.
     *
     * @throws ValidationException naming the first unusable field
     */
    public void validate() {
        if (clusterName == null || clusterName.isBlank()) {
            throw new ValidationException("config.clusterName", "must not be blank");
        }
        if (provider == null) {
            throw new ValidationException("config.provider", "must not be null");
        }
    }

    public TaskConfig withoutCredentials() {
        return new TaskConfig(clusterName, cloudAccountName, provider, Map.of(),
            profile, master, node, nodeProfile);
    }
}
