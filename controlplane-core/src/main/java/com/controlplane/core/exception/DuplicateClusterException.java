package com.controlplane.core.exception;

/**
 * Thrown when a cluster record is created under a name that is already taken.
 */
public class DuplicateClusterException extends ControlPlaneException {

    public static final String ERROR_CODE = "DUPLICATE_CLUSTER";

    public DuplicateClusterException(String clusterName) {
        super(ERROR_CODE, String.format("Cluster already exists: %s", clusterName));
    }
}
