package com.controlplane.core.step;

/**
 * Exception thrown by steps on failure.
 */
public class StepException extends Exception {

    public static final String STEP_FAILED = "STEP_FAILED";
    public static final String CANCELLED = "CANCELLED";

    private final String errorCode;

    public StepException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public StepException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public static StepException failed(String message) {
        return new StepException(STEP_FAILED, message);
    }

    public static StepException cancelled(String reason) {
        return new StepException(CANCELLED, "cancelled: " + reason);
    }
}
