package com.whereq.forge.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.forge.config.ForgeProperties;
import com.whereq.forge.exception.RetriesExhaustedException;
import com.whereq.forge.generation.GenerationExecutor;
import com.whereq.forge.generation.GenerationOutcome;
import com.whereq.forge.model.Job;
import com.whereq.forge.model.JobError;
import com.whereq.forge.model.JobStatus;
import com.whereq.forge.model.JobUpdate;
import com.whereq.forge.model.payload.GenerationPayload;
import com.whereq.forge.queue.JobQueue;
import com.whereq.forge.queue.QueueMessage;
import com.whereq.forge.queue.QueueMessageBody;
import com.whereq.forge.service.PayloadCodec;
import com.whereq.forge.store.JobStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Processes one received queue message against the job store.
 *
 * The message is deleted only after the job's terminal status is written, or once the
 * job is found to be terminal already. A message that is not deleted is redelivered after
 * its visibility timeout, which is how transient failures and crashed workers are retried.
 */
@Slf4j
@Component
public class JobMessageProcessor {

    @Autowired
    private JobStore jobStore;

    @Autowired
    private GenerationExecutor generationExecutor;

    @Autowired
    private PayloadCodec payloadCodec;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private ForgeProperties properties;

    @Autowired
    private MeterRegistry meterRegistry;

    @Autowired
    private Clock clock;

    private final Map<MessageOutcome, Counter> outcomeCounters = new EnumMap<>(MessageOutcome.class);

    @PostConstruct
    public void initialize() {
        for (MessageOutcome outcome : MessageOutcome.values()) {
            outcomeCounters.put(outcome, Counter.builder("forge.worker.messages")
                .description("Queue messages processed by outcome")
                .tag("outcome", outcome.name().toLowerCase())
                .register(meterRegistry));
        }
    }

    /**
     * Process a claimed message
     *
     * @param queue queue the message was received from
     * @param message the claimed message
     * @return Mono with what was done; does not error
     */
    public Mono<MessageOutcome> process(JobQueue queue, QueueMessage message) {
        return Mono.defer(() -> {
                QueueMessageBody body = parseBody(message);
                if (body == null) {
                    return acknowledge(queue, message, MessageOutcome.MALFORMED);
                }

                return jobStore.get(body.getJobId())
                    .flatMap(job -> handle(queue, message, body, job))
                    .switchIfEmpty(Mono.defer(() -> {
                        log.warn("No job {} for message {} on {} queue, deleting",
                            body.getJobId(), message.getMessageId(), queue.getType().getValue());
                        return acknowledge(queue, message, MessageOutcome.ORPHANED);
                    }));
            })
            .onErrorResume(e -> {
                log.error("Error processing message {} on {} queue, leaving it for redelivery: {}",
                    message.getMessageId(), queue.getType().getValue(), e.getMessage(), e);
                return Mono.just(MessageOutcome.ERROR);
            })
            .doOnNext(outcome -> outcomeCounters.get(outcome).increment());
    }

    private Mono<MessageOutcome> handle(JobQueue queue, QueueMessage message, QueueMessageBody body, Job job) {
        String jobId = job.getId();
        int receiveCount = queue.approximateReceiveCount(message);
        int maxReceives = properties.getQueue().getMaxReceives();

        if (job.getStatus().isTerminal()) {
            log.info("Job {} already {}, deleting duplicate message {}",
                jobId, job.getStatus().getValue(), message.getMessageId());
            return acknowledge(queue, message, MessageOutcome.DUPLICATE);
        }

        // Covers workers that crashed mid-generation on every earlier delivery
        if (receiveCount > maxReceives) {
            return exhaust(queue, message, jobId, new RetriesExhaustedException(jobId, receiveCount, maxReceives));
        }

        GenerationPayload payload;
        try {
            payload = body.getPayload() != null
                ? payloadCodec.read(job.getType(), body.getPayload())
                : job.getPayload();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Unreadable payload for job {}: {}", jobId, e.getMessage());
            JobUpdate update = JobUpdate.fail(JobError.of(JobError.Code.PERMANENT_GENERATION_ERROR,
                "Unreadable payload: " + e.getMessage()), clock.instant());
            return finish(queue, message, jobId, JobStatus.ACTIVE, JobStatus.FAILED, update, MessageOutcome.FAILED);
        }

        return jobStore.compareAndSetStatus(jobId, JobStatus.ACTIVE, JobStatus.PROCESSING,
                JobUpdate.startProcessing(clock.instant()))
            .flatMap(started -> {
                if (!started) {
                    log.info("Job {} finished before processing started, deleting message {}",
                        jobId, message.getMessageId());
                    return acknowledge(queue, message, MessageOutcome.DUPLICATE);
                }

                log.info("Processing {} job {} (delivery {}/{})",
                    job.getType().getValue(), jobId, receiveCount, maxReceives);

                return generationExecutor.execute(jobId, job.getType(), payload)
                    .flatMap(outcome -> record(queue, message, jobId, outcome, receiveCount, maxReceives));
            });
    }

    private Mono<MessageOutcome> record(JobQueue queue, QueueMessage message, String jobId,
                                        GenerationOutcome outcome, int receiveCount, int maxReceives) {
        return switch (outcome.getKind()) {
            case SUCCESS -> finish(queue, message, jobId, JobStatus.PROCESSING, JobStatus.COMPLETED,
                outcome.terminalUpdate(clock.instant()), MessageOutcome.COMPLETED);
            case PERMANENT_FAILURE -> finish(queue, message, jobId, JobStatus.PROCESSING, JobStatus.FAILED,
                outcome.terminalUpdate(clock.instant()), MessageOutcome.FAILED);
            case TRANSIENT_FAILURE -> {
                if (receiveCount >= maxReceives) {
                    yield exhaust(queue, message, jobId,
                        new RetriesExhaustedException(jobId, receiveCount, maxReceives, outcome.getError()));
                }
                log.warn("Transient failure for job {} on delivery {}/{}, message {} left for redelivery",
                    jobId, receiveCount, maxReceives, message.getMessageId());
                yield Mono.just(MessageOutcome.RETRY);
            }
        };
    }

    private Mono<MessageOutcome> exhaust(JobQueue queue, QueueMessage message, String jobId,
                                         RetriesExhaustedException exhausted) {
        log.warn(exhausted.getMessage());
        JobUpdate update = JobUpdate.fail(
            JobError.of(JobError.Code.RETRIES_EXHAUSTED, exhausted.getMessage()), clock.instant());
        return finish(queue, message, jobId, JobStatus.ACTIVE, JobStatus.FAILED, update, MessageOutcome.EXHAUSTED);
    }

    /**
     * Write a terminal status, then delete the message whether or not the write won
     */
    private Mono<MessageOutcome> finish(JobQueue queue, QueueMessage message, String jobId,
                                        Set<JobStatus> expected, JobStatus newStatus,
                                        JobUpdate update, MessageOutcome outcome) {
        return jobStore.compareAndSetStatus(jobId, expected, newStatus, update)
            .flatMap(applied -> {
                if (applied) {
                    log.info("Job {} {}", jobId, newStatus.getValue());
                    return acknowledge(queue, message, outcome);
                }
                log.info("Job {} became terminal meanwhile, discarding {} outcome", jobId, newStatus.getValue());
                return acknowledge(queue, message, MessageOutcome.DISCARDED);
            });
    }

    private Mono<MessageOutcome> finish(JobQueue queue, QueueMessage message, String jobId,
                                        JobStatus expected, JobStatus newStatus,
                                        JobUpdate update, MessageOutcome outcome) {
        return finish(queue, message, jobId, EnumSet.of(expected), newStatus, update, outcome);
    }

    private Mono<MessageOutcome> acknowledge(JobQueue queue, QueueMessage message, MessageOutcome outcome) {
        return queue.delete(message.getClaimHandle())
            .doOnNext(deleted -> {
                if (!deleted) {
                    log.warn("Message {} on {} queue was not deleted, claim expired before {}",
                        message.getMessageId(), queue.getType().getValue(), outcome);
                }
            })
            .thenReturn(outcome);
    }

    private QueueMessageBody parseBody(QueueMessage message) {
        try {
            QueueMessageBody body = objectMapper.readValue(message.getBody(), QueueMessageBody.class);
            if (body == null || body.getJobId() == null || body.getJobId().isBlank()) {
                log.error("Message {} has no job id, deleting", message.getMessageId());
                return null;
            }
            return body;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Malformed message {}, deleting: {}", message.getMessageId(), e.getMessage());
            return null;
        }
    }
}
