package com.whereq.forge.exception;

import com.whereq.forge.model.JobType;

/**
 * No queue is configured for a job type. Submission switches to synchronous generation.
 */
public class QueueUnavailableException extends RuntimeException {

    private final JobType type;

    public QueueUnavailableException(JobType type) {
        super("No queue configured for " + type.getValue() + " jobs");
        this.type = type;
    }

    public JobType getType() {
        return type;
    }
}
