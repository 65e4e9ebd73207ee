package com.footage.platform.scheduler.exception;

/**
 * Failure reported by a platform publisher. Subclasses decide whether the job may be retried.
 */
public abstract class PublishException extends RuntimeException {

    private final String errorCode;

    protected PublishException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public abstract boolean isRetryable();

    public String describe() {
        return String.format("[%s] %s", errorCode, getMessage());
    }
}
