package com.footage.platform.scheduler.exception;

public class TransientPublishException extends PublishException {

    public TransientPublishException(String errorCode, String message) {
        super(errorCode, message, null);
    }

    public TransientPublishException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
