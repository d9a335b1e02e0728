package com.controlplane.core.exception;

/**
 * Thrown when the durable store is unavailable or holds a record that cannot be decoded.
 */
public class StorageException extends ControlPlaneException {

    public static final String ERROR_CODE = "INTERNAL";

    public StorageException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }

    public StorageException(String message) {
        super(ERROR_CODE, message);
    }
}
