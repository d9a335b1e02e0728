package com.controlplane.core.exception;

/**
 * Thrown when a referenced cluster, task, workflow kind or provider mapping does not exist.
 * A normal negative result, reported to the caller.
 */
public class NotFoundException extends ControlPlaneException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
