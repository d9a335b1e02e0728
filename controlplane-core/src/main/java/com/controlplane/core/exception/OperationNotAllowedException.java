package com.controlplane.core.exception;

/**
 * Thrown when a request is well-formed but refused, e.g. deleting a master node.
 */
public class OperationNotAllowedException extends ControlPlaneException {

    public static final String ERROR_CODE = "OPERATION_NOT_ALLOWED";

    public OperationNotAllowedException(String message) {
        super(ERROR_CODE, message);
    }
}
