package com.whereq.forge.exception;

/**
 * Request rejected by the generation backend; the job fails without retry
 */
public class PermanentGenerationException extends GenerationException {

    public PermanentGenerationException(String message) {
        super(message);
    }

    public PermanentGenerationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
