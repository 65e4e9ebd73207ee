package com.footage.platform.scheduler.exception;

public class ContentEnrichmentException extends RuntimeException {

    public ContentEnrichmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
