package com.controlplane.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Requested shape of a node to provision.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeProfile(
    String size,
    String image,
    NodeRole role
) {
    public NodeRole effectiveRole() {
        return role != null ? role : NodeRole.WORKER;
    }
}
