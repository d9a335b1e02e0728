package com.controlplane.core.exception;

/**
 * Thrown when input is rejected before any task is created.
 */
public class ValidationException extends ControlPlaneException {

    public static final String ERROR_CODE = "VALIDATION_FAILED";

    public ValidationException(String message) {
        super(ERROR_CODE, message);
    }

    public ValidationException(String field, String reason) {
        super(ERROR_CODE, String.format("Invalid %s: %s", field, reason));
    }
}
