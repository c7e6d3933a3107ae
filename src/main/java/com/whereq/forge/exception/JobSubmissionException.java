package com.whereq.forge.exception;

/**
 * Exception thrown when an accepted job could not be handed to its queue
 */
public class JobSubmissionException extends RuntimeException {

    public JobSubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
