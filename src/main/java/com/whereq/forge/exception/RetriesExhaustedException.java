package com.whereq.forge.exception;

/**
 * Synthesized by the worker when a message has been delivered more often than allowed
 */
public class RetriesExhaustedException extends RuntimeException {

    public RetriesExhaustedException(String jobId, int receiveCount, int maxReceives) {
        super("Max retries exceeded for job " + jobId + ": delivered " + receiveCount
            + " times (limit " + maxReceives + ")");
    }

    public RetriesExhaustedException(String jobId, int receiveCount, int maxReceives, Throwable lastError) {
        super("Max retries exceeded for job " + jobId + ": delivered " + receiveCount
            + " times (limit " + maxReceives + "), last error: " + lastError.getMessage(), lastError);
    }
}
