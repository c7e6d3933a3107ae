package com.whereq.forge.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.forge.model.JobType;
import lombok.extern.slf4j.Slf4j;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Base for queues whose storage cannot block on arrival. Long-polling is emulated by
 * re-checking for visible messages every {@code longPollStep} until the wait elapses.
 * The wait is checked before each attempt, never by cancelling one.
 *
 * Claim handles have the form {@code messageId:receiveCount}, so a handle from an
 * earlier receipt no longer matches once the message has been received again.
 */
@Slf4j
public abstract class AbstractPollingJobQueue implements JobQueue {

    private static final char HANDLE_SEPARATOR = ':';

    protected final JobType type;
    protected final ObjectMapper objectMapper;
    protected final Duration visibilityTimeout;
    protected final Duration longPollStep;

    protected AbstractPollingJobQueue(JobType type, ObjectMapper objectMapper,
                                      Duration visibilityTimeout, Duration longPollStep) {
        this.type = type;
        this.objectMapper = objectMapper;
        this.visibilityTimeout = visibilityTimeout;
        this.longPollStep = longPollStep;
    }

    @Override
    public JobType getType() {
        return type;
    }

    @Override
    public Mono<String> enqueue(QueueMessageBody body) {
        String messageId = UUID.randomUUID().toString();

        return Mono.fromCallable(() -> {
                try {
                    return objectMapper.writeValueAsString(body);
                } catch (JsonProcessingException e) {
                    throw new IllegalArgumentException("Failed to serialize message for job " + body.getJobId(), e);
                }
            })
            .flatMap(json -> store(messageId, json))
            .doOnSuccess(v -> log.info("Enqueued job {} on {} queue as message {}",
                body.getJobId(), type.getValue(), messageId))
            .thenReturn(messageId);
    }

    @Override
    public Mono<List<QueueMessage>> receiveBatch(int maxMessages, Duration waitTime, Publisher<?> stopWaiting) {
        if (maxMessages <= 0) {
            return Mono.just(Collections.emptyList());
        }

        return Mono.defer(() -> {
            long deadline = System.nanoTime() + (waitTime == null ? 0 : Math.max(0, waitTime.toNanos()));
            return poll(maxMessages, deadline, Mono.from(stopWaiting).cache());
        });
    }

    /**
     * One claim attempt, then another after {@code longPollStep} while the batch is empty
     * and the deadline allows. Only the pause between attempts is cancellable; a running
     * claim has already hidden its messages and must reach the caller.
     */
    private Mono<List<QueueMessage>> poll(int maxMessages, long deadline, Mono<?> stopWaiting) {
        return claimVisible(maxMessages)
            .defaultIfEmpty(Collections.emptyList())
            .flatMap(batch -> {
                if (!batch.isEmpty() || System.nanoTime() + longPollStep.toNanos() > deadline) {
                    return Mono.just(batch);
                }
                return Mono.delay(longPollStep)
                    .takeUntilOther(stopWaiting)
                    .flatMap(tick -> poll(maxMessages, deadline, stopWaiting))
                    .defaultIfEmpty(batch);
            });
    }

    @Override
    public Mono<Boolean> delete(String claimHandle) {
        int separator = claimHandle == null ? -1 : claimHandle.lastIndexOf(HANDLE_SEPARATOR);
        if (separator <= 0) {
            return Mono.error(new IllegalArgumentException("Malformed claim handle: " + claimHandle));
        }

        String messageId = claimHandle.substring(0, separator);
        int receiveCount;
        try {
            receiveCount = Integer.parseInt(claimHandle.substring(separator + 1));
        } catch (NumberFormatException e) {
            return Mono.error(new IllegalArgumentException("Malformed claim handle: " + claimHandle, e));
        }

        return remove(messageId, receiveCount)
            .doOnNext(deleted -> {
                if (deleted) {
                    log.debug("Deleted message {} from {} queue", messageId, type.getValue());
                } else {
                    log.warn("Claim {} on {} queue is no longer valid, message not deleted",
                        claimHandle, type.getValue());
                }
            });
    }

    /**
     * Store a new, immediately visible message
     */
    protected abstract Mono<Void> store(String messageId, String body);

    /**
     * Claim up to {@code maxMessages} currently visible messages without waiting
     */
    protected abstract Mono<List<QueueMessage>> claimVisible(int maxMessages);

    /**
     * Remove a message if the claim issued at {@code receiveCount} is still current and unexpired
     */
    protected abstract Mono<Boolean> remove(String messageId, int receiveCount);

    protected static QueueMessage claimed(String messageId, int receiveCount, String body) {
        return new QueueMessage(messageId, messageId + HANDLE_SEPARATOR + receiveCount, body, receiveCount);
    }
}
