package com.whereq.forge.service;

import com.whereq.forge.config.ForgeProperties;
import com.whereq.forge.dto.JobCancellationResponse;
import com.whereq.forge.dto.JobSubmitRequest;
import com.whereq.forge.exception.JobNotFoundException;
import com.whereq.forge.exception.JobSubmissionException;
import com.whereq.forge.exception.JobValidationException;
import com.whereq.forge.exception.QueueUnavailableException;
import com.whereq.forge.exception.QuotaExceededException;
import com.whereq.forge.model.Job;
import com.whereq.forge.model.JobError;
import com.whereq.forge.model.JobStatus;
import com.whereq.forge.model.JobType;
import com.whereq.forge.model.JobUpdate;
import com.whereq.forge.model.payload.GenerationPayload;
import com.whereq.forge.queue.JobQueue;
import com.whereq.forge.queue.JobQueueRegistry;
import com.whereq.forge.queue.QueueMessageBody;
import com.whereq.forge.store.JobStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.UUID;

/**
 * Service for job submission, retry and cancellation
 */
@Slf4j
@Service
public class JobSubmissionService {

    @Autowired
    private JobStore jobStore;

    @Autowired
    private JobQueueRegistry queueRegistry;

    @Autowired
    private PayloadCodec payloadCodec;

    @Autowired
    private FallbackInvoker fallbackInvoker;

    @Autowired
    private ForgeProperties properties;

    @Autowired
    private MeterRegistry meterRegistry;

    @Autowired
    private Clock clock;

    private Counter queuedCounter;
    private Counter synchronousCounter;
    private Counter quotaRejectedCounter;
    private Counter cancelledCounter;
    private Counter retriedCounter;

    @PostConstruct
    public void initialize() {
        queuedCounter = Counter.builder("forge.jobs.queued")
            .description("Jobs accepted onto a queue")
            .register(meterRegistry);

        synchronousCounter = Counter.builder("forge.jobs.synchronous")
            .description("Jobs generated synchronously because their type has no queue")
            .register(meterRegistry);

        quotaRejectedCounter = Counter.builder("forge.jobs.quota.rejected")
            .description("Submissions rejected by the per-user active job limit")
            .register(meterRegistry);

        cancelledCounter = Counter.builder("forge.jobs.cancelled")
            .description("Jobs cancelled before finishing")
            .register(meterRegistry);

        retriedCounter = Counter.builder("forge.jobs.retried")
            .description("Failed jobs resubmitted as new jobs")
            .register(meterRegistry);
    }

    /**
     * Submit a job
     *
     * @param request job request
     * @return Mono with the job, queued or, when generated synchronously, terminal
     */
    public Mono<Job> submitJob(JobSubmitRequest request) {
        return Mono.fromCallable(() -> validate(request))
            .flatMap(payload -> admit(request.getUserId(), request.getType(), payload))
            .doOnSuccess(job -> log.info("Job {} submitted by user {} ({})",
                job.getId(), job.getUserId(), job.getStatus()))
            .doOnError(e -> log.error("Job submission failed for user {}: {}", request.getUserId(), e.getMessage()));
    }

    /**
     * Submit a new job with the type, owner and payload of a failed one.
     * The failed job is left as it is.
     *
     * @param jobId failed job identifier
     * @return Mono with the new job; errors with {@link JobValidationException} if the job has not failed
     */
    public Mono<Job> retryJob(String jobId) {
        return jobStore.get(jobId)
            .switchIfEmpty(Mono.error(() -> new JobNotFoundException(jobId)))
            .flatMap(failed -> {
                if (failed.getStatus() != JobStatus.FAILED) {
                    return Mono.error(new JobValidationException(
                        "Only failed jobs can be retried, job " + jobId + " is " + failed.getStatus().getValue()));
                }
                return admit(failed.getUserId(), failed.getType(), failed.getPayload());
            })
            .doOnSuccess(job -> {
                retriedCounter.increment();
                log.info("Job {} retried as job {} ({})", jobId, job.getId(), job.getStatus());
            })
            .doOnError(e -> log.error("Retry of job {} failed: {}", jobId, e.getMessage()));
    }

    /**
     * Cancel a queued or processing job. Cancelling a finished job changes nothing.
     *
     * @param jobId job identifier
     * @return Mono with cancellation response; errors with {@link JobNotFoundException} if unknown
     */
    public Mono<JobCancellationResponse> cancelJob(String jobId) {
        return jobStore.compareAndSetStatus(jobId, JobStatus.ACTIVE, JobStatus.CANCELLED, JobUpdate.cancel(clock.instant()))
            .flatMap(cancelled -> jobStore.get(jobId)
                .switchIfEmpty(Mono.error(() -> new JobNotFoundException(jobId)))
                .map(job -> {
                    if (cancelled) {
                        cancelledCounter.increment();
                        log.info("Job {} cancelled", jobId);
                    } else {
                        log.info("Job {} already {}, cancellation ignored", jobId, job.getStatus().getValue());
                    }
                    return JobCancellationResponse.builder()
                        .jobId(jobId)
                        .status(job.getStatus())
                        .cancelledAt(job.getCompletedAt())
                        .message(cancelled
                            ? "Job cancelled successfully"
                            : "Job already " + job.getStatus().getValue())
                        .build();
                }))
            .doOnError(e -> log.error("Failed to cancel job {}: {}", jobId, e.getMessage()));
    }

    private GenerationPayload validate(JobSubmitRequest request) {
        if (request.getUserId() == null || request.getUserId().isBlank()) {
            throw new JobValidationException("userId is required");
        }
        return payloadCodec.bind(request.getType(), request.getPayload());
    }

    /**
     * Quota check, then queue the job, or generate it now when the type has no queue
     */
    private Mono<Job> admit(String userId, JobType type, GenerationPayload payload) {
        return checkQuota(userId)
            .then(Mono.defer(() -> {
                Job job = Job.builder()
                    .id(generateJobId())
                    .type(type)
                    .userId(userId)
                    .payload(payload)
                    .attempts(0)
                    .createdAt(clock.instant())
                    .build();

                JobQueue queue;
                try {
                    queue = queueRegistry.require(type);
                } catch (QueueUnavailableException e) {
                    synchronousCounter.increment();
                    return fallbackInvoker.invoke(job);
                }
                return enqueueJob(queue, job.toBuilder().status(JobStatus.QUEUED).build());
            }));
    }

    private Mono<Void> checkQuota(String userId) {
        int limit = properties.getSubmission().getMaxActiveJobsPerUser();

        return jobStore.countActiveForUser(userId)
            .flatMap(active -> {
                if (active >= limit) {
                    quotaRejectedCounter.increment();
                    return Mono.error(new QuotaExceededException(userId, active, limit));
                }
                return Mono.empty();
            });
    }

    /**
     * Record the job as queued, then send its message
     */
    private Mono<Job> enqueueJob(JobQueue queue, Job job) {
        QueueMessageBody body = QueueMessageBody.builder()
            .jobId(job.getId())
            .type(job.getType())
            .payload(payloadCodec.toTree(job.getPayload()))
            .enqueuedAt(job.getCreatedAt())
            .build();

        return jobStore.create(job)
            .onErrorMap(e -> !(e instanceof JobSubmissionException),
                e -> new JobSubmissionException("Job " + job.getId() + " could not be recorded", e))
            .flatMap(created -> queue.enqueue(body)
                .doOnSuccess(messageId -> queuedCounter.increment())
                .thenReturn(created)
                .onErrorResume(e -> markEnqueueFailed(created, e)));
    }

    /**
     * Fail a job whose message could not be sent so it stops counting against the quota
     */
    private Mono<Job> markEnqueueFailed(Job job, Throwable cause) {
        log.error("Failed to enqueue job {}: {}", job.getId(), cause.getMessage(), cause);

        JobUpdate update = JobUpdate.fail(
            JobError.of(JobError.Code.ENQUEUE_FAILED, "Failed to enqueue job: " + cause.getMessage()),
            clock.instant());

        return jobStore.compareAndSetStatus(job.getId(), JobStatus.QUEUED, JobStatus.FAILED, update)
            .onErrorResume(e -> {
                log.error("Could not mark job {} as failed after enqueue error: {}", job.getId(), e.getMessage());
                return Mono.just(false);
            })
            .then(Mono.error(new JobSubmissionException("Job " + job.getId() + " could not be queued", cause)));
    }

    private String generateJobId() {
        return UUID.randomUUID().toString();
    }
}
