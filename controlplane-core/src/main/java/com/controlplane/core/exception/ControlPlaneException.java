package com.controlplane.core.exception;

/**
 * Base exception for all control plane errors.
 */
public class ControlPlaneException extends RuntimeException {

    private final String errorCode;

    public ControlPlaneException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ControlPlaneException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
