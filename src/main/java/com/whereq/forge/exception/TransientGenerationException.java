package com.whereq.forge.exception;

/**
 * Timeout, 5xx or connection failure; retried through queue redelivery
 */
public class TransientGenerationException extends GenerationException {

    public TransientGenerationException(String message) {
        super(message);
    }

    public TransientGenerationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
