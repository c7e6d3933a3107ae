package com.whereq.forge.service;

import com.whereq.forge.dto.JobDeletionResponse;
import com.whereq.forge.exception.JobNotFoundException;
import com.whereq.forge.exception.JobValidationException;
import com.whereq.forge.model.Job;
import com.whereq.forge.model.JobStatus;
import com.whereq.forge.store.JobStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Removes finished jobs from the store
 */
@Slf4j
@Service
public class JobCleanupService {

    @Autowired
    private JobStore jobStore;

    @Autowired
    private MeterRegistry meterRegistry;

    private Counter deletedCounter;

    @PostConstruct
    public void initialize() {
        deletedCounter = Counter.builder("forge.jobs.deleted")
            .description("Finished jobs removed from the store")
            .register(meterRegistry);
    }

    /**
     * Delete a single job. Queued and processing jobs must be cancelled first.
     *
     * @param jobId job identifier
     * @return Mono with deletion response; errors with {@link JobNotFoundException} if unknown
     *         and {@link JobValidationException} if the job is still active
     */
    public Mono<JobDeletionResponse> deleteJob(String jobId) {
        return jobStore.deleteIfStatus(jobId, JobStatus.TERMINAL)
            .flatMap(deleted -> {
                if (!deleted) {
                    return Mono.error(new JobValidationException("Cannot delete queued or processing job " + jobId));
                }
                deletedCounter.increment();
                log.info("Job {} deleted", jobId);
                return Mono.just(JobDeletionResponse.builder()
                    .jobId(jobId)
                    .deleted(1)
                    .message("Job deleted successfully")
                    .build());
            })
            .doOnError(e -> log.warn("Failed to delete job {}: {}", jobId, e.getMessage()));
    }

    /**
     * Delete a user's completed and failed jobs
     *
     * @param userId owner of the jobs
     * @param olderThan ISO-8601 instant or date; only jobs created before it are removed.
     *                  Null or blank removes all of them.
     * @return Mono with the number of jobs removed
     */
    public Mono<JobDeletionResponse> purgeFinishedJobs(String userId, String olderThan) {
        if (userId == null || userId.isBlank()) {
            return Mono.error(new JobValidationException("userId is required"));
        }

        Instant cutoff;
        try {
            cutoff = parseCutoff(olderThan);
        } catch (JobValidationException e) {
            return Mono.error(e);
        }

        return jobStore.listForUser(userId)
            .filter(job -> JobStatus.FINISHED.contains(job.getStatus()))
            .filter(job -> cutoff == null || job.getCreatedAt().isBefore(cutoff))
            .concatMap(this::deleteFinished)
            .filter(Boolean::booleanValue)
            .count()
            .map(deleted -> {
                deletedCounter.increment(deleted);
                log.info("Cleaned up {} finished jobs of user {}", deleted, userId);
                return JobDeletionResponse.builder()
                    .userId(userId)
                    .deleted(deleted)
                    .message("Queue cleaned successfully")
                    .build();
            });
    }

    // The job may have expired or been deleted since it was listed
    private Mono<Boolean> deleteFinished(Job job) {
        return jobStore.deleteIfStatus(job.getId(), JobStatus.FINISHED)
            .onErrorResume(JobNotFoundException.class, e -> Mono.just(false));
    }

    static Instant parseCutoff(String olderThan) {
        if (olderThan == null || olderThan.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(olderThan);
        } catch (DateTimeParseException e) {
            try {
                return LocalDate.parse(olderThan).atStartOfDay(ZoneOffset.UTC).toInstant();
            } catch (DateTimeParseException invalid) {
                throw new JobValidationException("olderThan must be an ISO-8601 instant or date: " + olderThan, invalid);
            }
        }
    }
}
