package com.whereq.forge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Classified, human-readable failure recorded on a failed job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobError {

    private Code code;

    private String message;

    public static JobError of(Code code, String message) {
        return new JobError(code, message);
    }

    public enum Code {
        /**
         * Generation backend rejected the request; retrying cannot help
         */
        PERMANENT_GENERATION_ERROR,

        /**
         * Generation backend was unreachable or overloaded and no retry is left
         */
        TRANSIENT_GENERATION_ERROR,

        /**
         * Message delivered more times than allowed
         */
        RETRIES_EXHAUSTED,

        /**
         * Job was recorded but its queue message could not be sent
         */
        ENQUEUE_FAILED
    }
}
