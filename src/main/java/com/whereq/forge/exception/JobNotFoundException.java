package com.whereq.forge.exception;

/**
 * Exception thrown when a job id is unknown to the job store
 */
public class JobNotFoundException extends RuntimeException {

    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
    }
}
