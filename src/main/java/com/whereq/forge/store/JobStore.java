package com.whereq.forge.store;

import com.whereq.forge.model.Job;
import com.whereq.forge.model.JobStatus;
import com.whereq.forge.model.JobUpdate;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.EnumSet;
import java.util.Set;

/**
 * Durable job records shared by the submission service and every worker.
 * Status changes go through {@link #compareAndSetStatus}, a single atomic
 * conditional write; there is no unconditional status update.
 */
public interface JobStore {

    /**
     * Persist a new job
     *
     * @param job the job, id already assigned
     * @return Mono with the stored job
     */
    Mono<Job> create(Job job);

    /**
     * Look up a job
     *
     * @param jobId job identifier
     * @return Mono with the job, empty if unknown
     */
    Mono<Job> get(String jobId);

    /**
     * Atomically move a job to {@code newStatus} and apply {@code update}, but only
     * if its current status is one of {@code expected}.
     *
     * @param jobId job identifier
     * @param expected statuses the job must currently be in
     * @param newStatus status to write
     * @param update fields written together with the status
     * @return Mono with true if the write happened, false if the job was in another status;
     *         errors with {@link com.whereq.forge.exception.JobNotFoundException} if the job is unknown
     */
    Mono<Boolean> compareAndSetStatus(String jobId, Set<JobStatus> expected, JobStatus newStatus, JobUpdate update);

    default Mono<Boolean> compareAndSetStatus(String jobId, JobStatus expected, JobStatus newStatus, JobUpdate update) {
        return compareAndSetStatus(jobId, EnumSet.of(expected), newStatus, update);
    }

    /**
     * Count jobs of a user that are queued or processing
     */
    Mono<Long> countActiveForUser(String userId);

    /**
     * All retained jobs of a user, newest first
     */
    Flux<Job> listForUser(String userId);

    /**
     * Remove a job, but only if its current status is one of {@code allowed}
     *
     * @return Mono with true if removed, false if the job was in another status;
     *         errors with {@link com.whereq.forge.exception.JobNotFoundException} if the job is unknown
     */
    Mono<Boolean> deleteIfStatus(String jobId, Set<JobStatus> allowed);

    /**
     * Reject conditional writes that no valid lifecycle path allows
     */
    static void checkTransition(Set<JobStatus> expected, JobStatus newStatus, JobUpdate update) {
        if (expected.isEmpty()) {
            throw new IllegalArgumentException("At least one expected status is required");
        }
        for (JobStatus from : expected) {
            if (!from.canTransitionTo(newStatus)) {
                throw new IllegalArgumentException("Illegal job transition " + from + " -> " + newStatus);
            }
        }
        update.checkConsistentWith(newStatus);
    }
}
