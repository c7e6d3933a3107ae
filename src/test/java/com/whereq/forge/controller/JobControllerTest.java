package com.whereq.forge.controller;

import com.whereq.forge.dto.JobCancellationResponse;
import com.whereq.forge.dto.JobDeletionResponse;
import com.whereq.forge.dto.JobListResponse;
import com.whereq.forge.dto.JobStatusResponse;
import com.whereq.forge.dto.JobSubmitRequest;
import com.whereq.forge.exception.JobNotFoundException;
import com.whereq.forge.exception.JobSubmissionException;
import com.whereq.forge.exception.JobValidationException;
import com.whereq.forge.exception.QuotaExceededException;
import com.whereq.forge.model.GenerationResult;
import com.whereq.forge.model.Job;
import com.whereq.forge.model.JobStatus;
import com.whereq.forge.model.JobType;
import com.whereq.forge.model.JobUpdate;
import com.whereq.forge.service.JobCleanupService;
import com.whereq.forge.service.JobQueryService;
import com.whereq.forge.service.JobSubmissionService;
import com.whereq.forge.support.TestJobs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private JobSubmissionService jobSubmissionService;

    @Mock
    private JobQueryService jobQueryService;

    @Mock
    private JobCleanupService jobCleanupService;

    @InjectMocks
    private JobController controller;

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        client = WebTestClient.bindToController(controller).build();
    }

    @Test
    void queuedSubmissionIsAccepted() {
        Job job = TestJobs.queuedImageJob("user-1", NOW);
        when(jobSubmissionService.submitJob(any(JobSubmitRequest.class))).thenReturn(Mono.just(job));

        client.post().uri("/api/v1/jobs")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(imageRequest())
            .exchange()
            .expectStatus().isAccepted()
            .expectHeader().location("/api/v1/jobs/" + job.getId())
            .expectBody()
            .jsonPath("$.jobId").isEqualTo(job.getId())
            .jsonPath("$.status").isEqualTo("queued")
            .jsonPath("$.job").doesNotExist();
    }

    @Test
    @DisplayName("a synchronously generated job is returned finished with 200")
    void synchronousSubmissionReturnsFinishedJob() {
        Job job = TestJobs.queuedImageJob("user-1", NOW).toBuilder()
            .status(JobStatus.PROCESSING)
            .build()
            .withTransition(JobStatus.COMPLETED, JobUpdate.complete(
                GenerationResult.builder().url("https://cdn.example.com/a.png").build(), NOW));
        when(jobSubmissionService.submitJob(any(JobSubmitRequest.class))).thenReturn(Mono.just(job));

        client.post().uri("/api/v1/jobs")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(imageRequest())
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("completed")
            .jsonPath("$.job.result.url").isEqualTo("https://cdn.example.com/a.png");
    }

    @Test
    void invalidPayloadIsBadRequest() {
        when(jobSubmissionService.submitJob(any(JobSubmitRequest.class)))
            .thenReturn(Mono.error(new JobValidationException(List.of("prompt is required"))));

        client.post().uri("/api/v1/jobs")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(imageRequest())
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.violations[0]").isEqualTo("prompt is required");
    }

    @Test
    void missingTypeIsRejectedBeforeSubmission() {
        client.post().uri("/api/v1/jobs")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("userId", "user-1", "payload", Map.of("prompt", "a lighthouse")))
            .exchange()
            .expectStatus().isBadRequest();

        verifyNoInteractions(jobSubmissionService);
    }

    @Test
    void quotaExceededIsTooManyRequests() {
        when(jobSubmissionService.submitJob(any(JobSubmitRequest.class)))
            .thenReturn(Mono.error(new QuotaExceededException("user-1", 5, 5)));

        client.post().uri("/api/v1/jobs")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(imageRequest())
            .exchange()
            .expectStatus().isEqualTo(429)
            .expectBody()
            .jsonPath("$.errorMessage").exists();
    }

    @Test
    void enqueueFailureIsServiceUnavailable() {
        when(jobSubmissionService.submitJob(any(JobSubmitRequest.class)))
            .thenReturn(Mono.error(new JobSubmissionException("Job could not be queued", new IllegalStateException("redis down"))));

        client.post().uri("/api/v1/jobs")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(imageRequest())
            .exchange()
            .expectStatus().isEqualTo(503);
    }

    @Test
    void getJobReturnsStatus() {
        Job job = TestJobs.queuedImageJob("user-1", NOW);
        when(jobQueryService.getJob(job.getId())).thenReturn(Mono.just(JobStatusResponse.fromJob(job)));

        client.get().uri("/api/v1/jobs/{id}", job.getId())
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.jobId").isEqualTo(job.getId())
            .jsonPath("$.type").isEqualTo("image")
            .jsonPath("$.status").isEqualTo("queued")
            .jsonPath("$.attempts").isEqualTo(0);
    }

    @Test
    void unknownJobIsNotFound() {
        when(jobQueryService.getJob("missing")).thenReturn(Mono.error(new JobNotFoundException("missing")));

        client.get().uri("/api/v1/jobs/missing")
            .exchange()
            .expectStatus().isNotFound();
    }

    @Test
    void cancelReturnsCurrentState() {
        when(jobSubmissionService.cancelJob("job-1")).thenReturn(Mono.just(JobCancellationResponse.builder()
            .jobId("job-1")
            .status(JobStatus.CANCELLED)
            .cancelledAt(NOW)
            .message("Job cancelled successfully")
            .build()));

        client.post().uri("/api/v1/jobs/job-1/cancel")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("cancelled")
            .jsonPath("$.message").isEqualTo("Job cancelled successfully");
    }

    @Test
    void cancelUnknownJobIsNotFound() {
        when(jobSubmissionService.cancelJob("missing")).thenReturn(Mono.error(new JobNotFoundException("missing")));

        client.post().uri("/api/v1/jobs/missing/cancel")
            .exchange()
            .expectStatus().isNotFound();
    }

    @Test
    void listJobsPassesFilterAndPaging() {
        when(jobQueryService.listJobs("user-1", JobStatus.FAILED, 10, 5)).thenReturn(Mono.just(JobListResponse.builder()
            .userId("user-1")
            .jobs(List.of())
            .total(7)
            .limit(10)
            .offset(5)
            .stats(Map.of("failed", 7L))
            .build()));

        client.get().uri("/api/v1/jobs?userId=user-1&status=failed&limit=10&offset=5")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.total").isEqualTo(7)
            .jsonPath("$.stats.failed").isEqualTo(7);
    }

    @Test
    void listJobsRejectsUnknownStatus() {
        client.get().uri("/api/v1/jobs?userId=user-1&status=sleeping")
            .exchange()
            .expectStatus().isBadRequest();

        verifyNoInteractions(jobQueryService);
    }

    @Test
    void listJobsRejectsBadPaging() {
        when(jobQueryService.listJobs(eq("user-1"), eq(null), eq(500), eq(0)))
            .thenReturn(Mono.error(new JobValidationException("limit must be between 1 and 100")));

        client.get().uri("/api/v1/jobs?userId=user-1&limit=500")
            .exchange()
            .expectStatus().isBadRequest();
    }

    @Test
    void retryOfFailedJobIsAccepted() {
        Job retried = TestJobs.queuedImageJob("user-1", NOW);
        when(jobSubmissionService.retryJob("failed-1")).thenReturn(Mono.just(retried));

        client.post().uri("/api/v1/jobs/failed-1/retry")
            .exchange()
            .expectStatus().isAccepted()
            .expectHeader().location("/api/v1/jobs/" + retried.getId())
            .expectBody()
            .jsonPath("$.jobId").isEqualTo(retried.getId())
            .jsonPath("$.status").isEqualTo("queued");
    }

    @Test
    void retryOfJobThatHasNotFailedIsBadRequest() {
        when(jobSubmissionService.retryJob("job-1"))
            .thenReturn(Mono.error(new JobValidationException("Only failed jobs can be retried, job job-1 is completed")));

        client.post().uri("/api/v1/jobs/job-1/retry")
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.violations[0]").isEqualTo("Only failed jobs can be retried, job job-1 is completed");
    }

    @Test
    void retryErrorsMapToStatusCodes() {
        when(jobSubmissionService.retryJob("missing")).thenReturn(Mono.error(new JobNotFoundException("missing")));
        when(jobSubmissionService.retryJob("busy")).thenReturn(Mono.error(new QuotaExceededException("user-1", 5, 5)));
        when(jobSubmissionService.retryJob("down"))
            .thenReturn(Mono.error(new JobSubmissionException("Job x could not be queued", new IllegalStateException())));

        client.post().uri("/api/v1/jobs/missing/retry").exchange().expectStatus().isNotFound();
        client.post().uri("/api/v1/jobs/busy/retry").exchange().expectStatus().isEqualTo(429);
        client.post().uri("/api/v1/jobs/down/retry").exchange().expectStatus().isEqualTo(503);
    }

    @Test
    void finishedJobIsDeleted() {
        when(jobCleanupService.deleteJob("job-1")).thenReturn(Mono.just(JobDeletionResponse.builder()
            .jobId("job-1")
            .deleted(1)
            .message("Job deleted successfully")
            .build()));

        client.delete().uri("/api/v1/jobs/job-1")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.jobId").isEqualTo("job-1")
            .jsonPath("$.deleted").isEqualTo(1)
            .jsonPath("$.userId").doesNotExist();
    }

    @Test
    @DisplayName("deleting a queued or processing job is a bad request, an unknown one is not found")
    void activeOrUnknownJobIsNotDeleted() {
        when(jobCleanupService.deleteJob("job-1"))
            .thenReturn(Mono.error(new JobValidationException("Cannot delete queued or processing job job-1")));
        when(jobCleanupService.deleteJob("missing")).thenReturn(Mono.error(new JobNotFoundException("missing")));

        client.delete().uri("/api/v1/jobs/job-1")
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.message").isEqualTo("Cannot delete queued or processing job job-1");

        client.delete().uri("/api/v1/jobs/missing")
            .exchange()
            .expectStatus().isNotFound();
    }

    @Test
    void cleanupReportsDeletedCount() {
        when(jobCleanupService.purgeFinishedJobs("user-1", "2026-03-01"))
            .thenReturn(Mono.just(JobDeletionResponse.builder()
                .userId("user-1")
                .deleted(3)
                .message("Queue cleaned successfully")
                .build()));

        client.delete().uri("/api/v1/jobs?userId=user-1&olderThan=2026-03-01")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.deleted").isEqualTo(3)
            .jsonPath("$.message").isEqualTo("Queue cleaned successfully");
    }

    @Test
    void cleanupWithUnreadableCutoffIsBadRequest() {
        when(jobCleanupService.purgeFinishedJobs("user-1", "yesterday"))
            .thenReturn(Mono.error(new JobValidationException("olderThan must be an ISO-8601 instant or date: yesterday")));

        client.delete().uri("/api/v1/jobs?userId=user-1&olderThan=yesterday")
            .exchange()
            .expectStatus().isBadRequest();
    }

    private static Map<String, Object> imageRequest() {
        return Map.of(
            "userId", "user-1",
            "type", "image",
            "payload", Map.of("prompt", "a lighthouse at dusk"));
    }
}
