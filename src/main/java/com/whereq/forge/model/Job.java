package com.whereq.forge.model;

import com.whereq.forge.model.payload.GenerationPayload;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Durable record of one generation request and its lifecycle
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Job {
    /**
     * Unique job identifier
     */
    private String id;

    /**
     * Selects queue and payload shape
     */
    private JobType type;

    /**
     * User who submitted the job
     */
    private String userId;

    /**
     * Current status
     */
    private JobStatus status;

    /**
     * Type-specific generation parameters
     */
    private GenerationPayload payload;

    /**
     * Processing attempts observed by workers
     */
    private int attempts;

    /**
     * Set only when completed
     */
    private GenerationResult result;

    /**
     * Set only when failed
     */
    private JobError error;

    private Instant createdAt;

    /**
     * First transition to processing
     */
    private Instant startedAt;

    /**
     * Transition to a terminal status
     */
    private Instant completedAt;

    /**
     * Copy of this job with {@code update} applied under {@code newStatus}.
     * Callers are responsible for checking the expected current status.
     */
    public Job withTransition(JobStatus newStatus, JobUpdate update) {
        update.checkConsistentWith(newStatus);
        JobBuilder next = toBuilder().status(newStatus);
        if (update.isIncrementAttempts()) {
            next.attempts(attempts + 1);
        }
        if (update.getStartedAt() != null && startedAt == null) {
            next.startedAt(update.getStartedAt());
        }
        if (update.getCompletedAt() != null) {
            next.completedAt(update.getCompletedAt());
        }
        if (update.getResult() != null) {
            next.result(update.getResult());
        }
        if (update.getError() != null) {
            next.error(update.getError());
        }
        return next.build();
    }
}
