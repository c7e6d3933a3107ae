package com.whereq.forge.exception;

import java.util.List;

/**
 * Exception thrown when a submission is malformed. No job exists for a rejected submission.
 */
public class JobValidationException extends RuntimeException {

    private final List<String> violations;

    public JobValidationException(String message) {
        this(List.of(message));
    }

    public JobValidationException(List<String> violations) {
        super(String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public JobValidationException(String message, Throwable cause) {
        super(message, cause);
        this.violations = List.of(message);
    }

    public List<String> getViolations() {
        return violations;
    }
}
