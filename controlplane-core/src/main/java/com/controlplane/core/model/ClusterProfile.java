package com.controlplane.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Cluster-wide settings every node of a cluster is built with.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClusterProfile(
    String region,
    String k8sVersion,
    String operatingSystem,
    String dockerVersion,
    String networkType,
    String cidr,
    boolean rbacEnabled
) {
}
