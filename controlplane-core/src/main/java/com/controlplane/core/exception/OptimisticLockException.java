package com.controlplane.core.exception;

/**
 * Thrown when a compare-and-swap update keeps losing against concurrent writers.
 */
public class OptimisticLockException extends ControlPlaneException {

    public static final String ERROR_CODE = "OPTIMISTIC_LOCK_CONFLICT";

    public OptimisticLockException(String entityType, String entityId, int attempts) {
        super(ERROR_CODE, String.format(
            "Optimistic lock conflict on %s[%s]: gave up after %d attempts",
            entityType, entityId, attempts
        ));
    }
}
