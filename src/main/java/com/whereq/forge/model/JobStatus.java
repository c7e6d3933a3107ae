package com.whereq.forge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Job lifecycle states
 *
 * State transitions:
 * QUEUED → PROCESSING → {COMPLETED, FAILED}
 * QUEUED | PROCESSING → CANCELLED
 * PROCESSING → PROCESSING (redelivered message)
 * QUEUED → FAILED (enqueue failure, exhausted deliveries)
 * Fallback jobs are created directly in COMPLETED or FAILED.
 */
public enum JobStatus {
    /**
     * Accepted and waiting in a queue
     */
    QUEUED("queued"),

    /**
     * Claimed by a worker, generation in progress
     */
    PROCESSING("processing"),

    /**
     * Completed successfully, result recorded
     */
    COMPLETED("completed"),

    /**
     * Terminated with error
     */
    FAILED("failed"),

    /**
     * User-initiated cancellation
     */
    CANCELLED("cancelled");

    /**
     * Statuses counted against the per-user quota and eligible for cancellation
     */
    public static final Set<JobStatus> ACTIVE = Collections.unmodifiableSet(EnumSet.of(QUEUED, PROCESSING));

    /**
     * Statuses a job never leaves; only these may be deleted
     */
    public static final Set<JobStatus> TERMINAL = Collections.unmodifiableSet(EnumSet.of(COMPLETED, FAILED, CANCELLED));

    /**
     * Statuses removed by a bulk cleanup
     */
    public static final Set<JobStatus> FINISHED = Collections.unmodifiableSet(EnumSet.of(COMPLETED, FAILED));

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static JobStatus fromValue(String value) {
        for (JobStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown job status: " + value);
    }

    /**
     * Check if this is a terminal state
     */
    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /**
     * Check if job still holds a quota slot
     */
    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    /**
     * Check whether a conditional write may move a job from this status to {@code next}
     */
    public boolean canTransitionTo(JobStatus next) {
        return switch (this) {
            case QUEUED -> next == PROCESSING || next == FAILED || next == CANCELLED;
            case PROCESSING -> next == PROCESSING || next == COMPLETED || next == FAILED || next == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
