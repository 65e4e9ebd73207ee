package com.footage.platform.scheduler.exception;

/**
 * A schedule or enqueue request that can never become a valid job. Rejected before anything is queued.
 */
public class InvalidJobException extends RuntimeException {

    public InvalidJobException(String message) {
        super(message);
    }

    public InvalidJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
