package com.footage.platform.scheduler.exception;

public class JobNotFoundException extends RuntimeException {

    public JobNotFoundException(Long jobId) {
        super("Publish job not found: " + jobId);
    }
}
