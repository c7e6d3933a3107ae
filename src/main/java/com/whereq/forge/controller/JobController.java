package com.whereq.forge.controller;

import com.whereq.forge.dto.JobCancellationResponse;
import com.whereq.forge.dto.JobDeletionResponse;
import com.whereq.forge.dto.JobListResponse;
import com.whereq.forge.dto.JobStatusResponse;
import com.whereq.forge.dto.JobSubmitRequest;
import com.whereq.forge.dto.JobSubmitResponse;
import com.whereq.forge.exception.JobNotFoundException;
import com.whereq.forge.exception.JobSubmissionException;
import com.whereq.forge.exception.JobValidationException;
import com.whereq.forge.exception.QuotaExceededException;
import com.whereq.forge.model.Job;
import com.whereq.forge.model.JobStatus;
import com.whereq.forge.service.JobCleanupService;
import com.whereq.forge.service.JobQueryService;
import com.whereq.forge.service.JobSubmissionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * Controller for generation job submission, status, retry, cancellation and cleanup
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/jobs")
@Tag(name = "Jobs", description = "Asynchronous content generation jobs")
public class JobController {

    @Autowired
    private JobSubmissionService jobSubmissionService;

    @Autowired
    private JobQueryService jobQueryService;

    @Autowired
    private JobCleanupService jobCleanupService;

    /**
     * Submit a generation job
     *
     * @param request job request
     * @return Mono with 202 Accepted for a queued job, or 200 OK with the finished job
     *         when its type is generated synchronously
     */
    @PostMapping
    @Operation(summary = "Submit job", description = "Queue an article, image or video generation job")
    public Mono<ResponseEntity<JobSubmitResponse>> submitJob(@Valid @RequestBody JobSubmitRequest request) {
        log.info("Received {} job submission from user {}",
            request.getType() != null ? request.getType().getValue() : "untyped", request.getUserId());

        return jobSubmissionService.submitJob(request)
            .map(JobController::toSubmitResponse)
            .onErrorResume(JobValidationException.class, e -> {
                log.warn("Validation error: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .badRequest()
                    .body(JobSubmitResponse.invalid(e.getViolations())));
            })
            .onErrorResume(QuotaExceededException.class, e -> {
                log.warn("Quota exceeded: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .status(HttpStatus.TOO_MANY_REQUESTS)
                    .body(JobSubmitResponse.error(e.getMessage())));
            })
            .onErrorResume(JobSubmissionException.class, e -> {
                log.error("Job could not be queued: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(JobSubmitResponse.error(e.getMessage())));
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Unexpected error during job submission", e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(JobSubmitResponse.error("Internal server error: " + e.getMessage())));
            });
    }

    /**
     * Get job status
     *
     * @param jobId job identifier
     * @return Mono with job status
     */
    @GetMapping("/{jobId}")
    @Operation(summary = "Get job", description = "Current status, result or error of a job")
    public Mono<ResponseEntity<JobStatusResponse>> getJobStatus(@PathVariable String jobId) {
        log.debug("Job status request for {}", jobId);

        return jobQueryService.getJob(jobId)
            .map(ResponseEntity::ok)
            .onErrorResume(JobNotFoundException.class, e -> Mono.just(ResponseEntity.notFound().build()))
            .onErrorResume(Exception.class, e -> {
                log.error("Error reading job {}", jobId, e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .build());
            });
    }

    /**
     * Cancel a job. Cancelling a finished job returns its current state.
     *
     * @param jobId job identifier
     * @return Mono with cancellation response
     */
    @PostMapping("/{jobId}/cancel")
    @Operation(summary = "Cancel job", description = "Cancel a queued or processing job")
    public Mono<ResponseEntity<JobCancellationResponse>> cancelJob(@PathVariable String jobId) {
        log.info("Job cancellation request for {}", jobId);

        return jobSubmissionService.cancelJob(jobId)
            .map(ResponseEntity::ok)
            .onErrorResume(JobNotFoundException.class, e -> Mono.just(ResponseEntity.notFound().build()))
            .onErrorResume(Exception.class, e -> {
                log.error("Error cancelling job {}", jobId, e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .build());
            });
    }

    /**
     * Retry a failed job as a new job
     *
     * @param jobId failed job identifier
     * @return Mono with the new job, 202 Accepted when queued
     */
    @PostMapping("/{jobId}/retry")
    @Operation(summary = "Retry job", description = "Submit a failed job's payload again as a new job")
    public Mono<ResponseEntity<JobSubmitResponse>> retryJob(@PathVariable String jobId) {
        log.info("Job retry request for {}", jobId);

        return jobSubmissionService.retryJob(jobId)
            .map(JobController::toSubmitResponse)
            .onErrorResume(JobNotFoundException.class, e -> Mono.just(ResponseEntity.notFound().build()))
            .onErrorResume(JobValidationException.class, e -> {
                log.warn("Retry rejected: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .badRequest()
                    .body(JobSubmitResponse.invalid(e.getViolations())));
            })
            .onErrorResume(QuotaExceededException.class, e -> {
                log.warn("Quota exceeded: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .status(HttpStatus.TOO_MANY_REQUESTS)
                    .body(JobSubmitResponse.error(e.getMessage())));
            })
            .onErrorResume(JobSubmissionException.class, e -> {
                log.error("Retried job could not be queued: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(JobSubmitResponse.error(e.getMessage())));
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Unexpected error retrying job {}", jobId, e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(JobSubmitResponse.error("Internal server error: " + e.getMessage())));
            });
    }

    /**
     * Delete a finished job
     *
     * @param jobId job identifier
     * @return Mono with deletion response, 400 if the job is still queued or processing
     */
    @DeleteMapping("/{jobId}")
    @Operation(summary = "Delete job", description = "Remove a completed, failed or cancelled job")
    public Mono<ResponseEntity<JobDeletionResponse>> deleteJob(@PathVariable String jobId) {
        log.info("Job deletion request for {}", jobId);

        return jobCleanupService.deleteJob(jobId)
            .map(ResponseEntity::ok)
            .onErrorResume(JobNotFoundException.class, e -> Mono.just(ResponseEntity.notFound().build()))
            .onErrorResume(JobValidationException.class, e -> Mono.just(ResponseEntity
                .badRequest()
                .body(JobDeletionResponse.error(e.getMessage()))))
            .onErrorResume(Exception.class, e -> {
                log.error("Error deleting job {}", jobId, e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(JobDeletionResponse.error("Failed to delete job")));
            });
    }

    /**
     * Delete a user's completed and failed jobs
     *
     * @param userId owner of the jobs
     * @param olderThan optional ISO-8601 instant or date; only jobs created before it are removed
     * @return Mono with the number of jobs removed
     */
    @DeleteMapping
    @Operation(summary = "Clean up jobs", description = "Remove a user's completed and failed jobs")
    public Mono<ResponseEntity<JobDeletionResponse>> cleanupJobs(
            @RequestParam String userId,
            @RequestParam(required = false) String olderThan) {
        log.info("Job cleanup request for user {} (olderThan={})", userId, olderThan);

        return jobCleanupService.purgeFinishedJobs(userId, olderThan)
            .map(ResponseEntity::ok)
            .onErrorResume(JobValidationException.class, e -> Mono.just(ResponseEntity
                .badRequest()
                .body(JobDeletionResponse.error(e.getMessage()))))
            .onErrorResume(Exception.class, e -> {
                log.error("Error cleaning up jobs of user {}", userId, e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(JobDeletionResponse.error("Failed to clean queue")));
            });
    }

    /**
     * List a user's jobs, newest first
     */
    @GetMapping
    @Operation(summary = "List jobs", description = "Jobs of a user with per-status counts")
    public Mono<ResponseEntity<JobListResponse>> listJobs(
            @RequestParam String userId,
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(defaultValue = "0") int offset) {

        JobStatus statusFilter;
        try {
            statusFilter = status == null || status.isBlank() ? null : JobStatus.fromValue(status);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid status filter: {}", status);
            return Mono.just(ResponseEntity.badRequest().build());
        }

        return jobQueryService.listJobs(userId, statusFilter, limit, offset)
            .map(ResponseEntity::ok)
            .onErrorResume(JobValidationException.class, e -> {
                log.warn("Invalid job list request: {}", e.getMessage());
                return Mono.just(ResponseEntity.badRequest().build());
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Error listing jobs for user {}", userId, e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .build());
            });
    }

    private static ResponseEntity<JobSubmitResponse> toSubmitResponse(Job job) {
        JobSubmitResponse response = JobSubmitResponse.fromJob(job);
        if (job.getStatus() == JobStatus.QUEUED) {
            return ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .location(URI.create("/api/v1/jobs/" + job.getId()))
                .body(response);
        }
        return ResponseEntity.ok(response);
    }
}
