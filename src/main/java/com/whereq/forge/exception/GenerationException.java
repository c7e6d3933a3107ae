package com.whereq.forge.exception;

/**
 * Classified failure of a generation backend call
 */
public abstract class GenerationException extends RuntimeException {

    protected GenerationException(String message) {
        super(message);
    }

    protected GenerationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether the same request may succeed if retried
     */
    public abstract boolean isRetryable();
}
