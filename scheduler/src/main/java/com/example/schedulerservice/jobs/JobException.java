package com.example.schedulerservice.jobs;

/**
 * Base type for rejected register/deregister requests. The error code is what
 * callers see as the {@code status} field of an error response.
 */
public abstract class JobException extends RuntimeException {
    private final String errorCode;

    protected JobException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected JobException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
