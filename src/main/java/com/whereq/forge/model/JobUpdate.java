package com.whereq.forge.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Fields written together with a status change in a single conditional update
 */
@Value
@Builder
public class JobUpdate {

    boolean incrementAttempts;

    /**
     * Written only if the job has no start time yet
     */
    Instant startedAt;

    Instant completedAt;

    GenerationResult result;

    JobError error;

    public static JobUpdate startProcessing(Instant now) {
        return JobUpdate.builder()
            .incrementAttempts(true)
            .startedAt(now)
            .build();
    }

    public static JobUpdate complete(GenerationResult result, Instant now) {
        if (result == null) {
            throw new IllegalArgumentException("A completed job requires a result");
        }
        return JobUpdate.builder()
            .result(result)
            .completedAt(now)
            .build();
    }

    public static JobUpdate fail(JobError error, Instant now) {
        if (error == null) {
            throw new IllegalArgumentException("A failed job requires an error");
        }
        return JobUpdate.builder()
            .error(error)
            .completedAt(now)
            .build();
    }

    public static JobUpdate cancel(Instant now) {
        return JobUpdate.builder()
            .completedAt(now)
            .build();
    }

    /**
     * Reject updates that would break "result iff completed, error iff failed"
     */
    public void checkConsistentWith(JobStatus status) {
        if ((status == JobStatus.COMPLETED) != (result != null)) {
            throw new IllegalArgumentException("Result must be set exactly when status is completed, got " + status);
        }
        if ((status == JobStatus.FAILED) != (error != null)) {
            throw new IllegalArgumentException("Error must be set exactly when status is failed, got " + status);
        }
    }
}
