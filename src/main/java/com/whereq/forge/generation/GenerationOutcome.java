package com.whereq.forge.generation;

import com.whereq.forge.model.GenerationResult;
import com.whereq.forge.model.JobError;
import com.whereq.forge.model.JobStatus;
import com.whereq.forge.model.JobUpdate;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

/**
 * Classified result of one generation attempt
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class GenerationOutcome {

    public enum Kind {
        SUCCESS,
        PERMANENT_FAILURE,
        TRANSIENT_FAILURE
    }

    private final Kind kind;

    private final GenerationResult result;

    private final Throwable error;

    public static GenerationOutcome success(GenerationResult result) {
        return new GenerationOutcome(Kind.SUCCESS, result, null);
    }

    public static GenerationOutcome permanentFailure(Throwable error) {
        return new GenerationOutcome(Kind.PERMANENT_FAILURE, null, error);
    }

    public static GenerationOutcome transientFailure(Throwable error) {
        return new GenerationOutcome(Kind.TRANSIENT_FAILURE, null, error);
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    public String getErrorMessage() {
        if (error == null) {
            return null;
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    /**
     * Status a job takes when this outcome is final for it
     */
    public JobStatus terminalStatus() {
        return isSuccess() ? JobStatus.COMPLETED : JobStatus.FAILED;
    }

    /**
     * Fields to write with {@link #terminalStatus()}
     */
    public JobUpdate terminalUpdate(Instant now) {
        return switch (kind) {
            case SUCCESS -> JobUpdate.complete(result, now);
            case PERMANENT_FAILURE -> JobUpdate.fail(
                JobError.of(JobError.Code.PERMANENT_GENERATION_ERROR, getErrorMessage()), now);
            case TRANSIENT_FAILURE -> JobUpdate.fail(
                JobError.of(JobError.Code.TRANSIENT_GENERATION_ERROR, getErrorMessage()), now);
        };
    }
}
