package com.controlplane.core.model;

/**
 * Logical operations a caller asks for; resolved per provider to a workflow kind.
 */
public enum Intent {
    DELETE_CLUSTER,
    DELETE_NODE,
    PROVISION_NODE
}
