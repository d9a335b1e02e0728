package com.controlplane.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Identity of a machine that is, or will become, part of a cluster.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeSpec(
    String name,
    String providerId,
    NodeRole role,
    String region,
    String privateIp,
    String publicIp
) {
    public static NodeSpec named(String name) {
        return new NodeSpec(name, null, NodeRole.WORKER, null, null, null);
    }
}
