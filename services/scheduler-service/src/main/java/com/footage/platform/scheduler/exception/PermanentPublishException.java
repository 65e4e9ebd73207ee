package com.footage.platform.scheduler.exception;

/**
 * Non-retryable rejection, e.g. a content policy violation. The job is abandoned immediately.
 */
public class PermanentPublishException extends PublishException {

    public PermanentPublishException(String errorCode, String message) {
        super(errorCode, message, null);
    }

    public PermanentPublishException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
