package com.whereq.forge.queue;

import com.whereq.forge.model.JobType;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * At-least-once message channel for one job type.
 *
 * A received message stays hidden from other receivers for the visibility timeout.
 * Deleting it with its claim handle acknowledges it; there is no negative acknowledge,
 * a message that is not deleted simply becomes visible again and is redelivered.
 */
public interface JobQueue {

    /**
     * Job type this queue carries
     */
    JobType getType();

    /**
     * Enqueue a message
     *
     * @param body the message body
     * @return Mono with the message id
     */
    Mono<String> enqueue(QueueMessageBody body);

    /**
     * Receive and claim a batch of messages, waiting up to {@code waitTime}
     * for at least one to become visible
     *
     * @param maxMessages maximum messages to claim
     * @param waitTime long-poll wait, zero for a single attempt
     * @return Mono with the claimed messages, empty list if none arrived in time
     */
    default Mono<List<QueueMessage>> receiveBatch(int maxMessages, Duration waitTime) {
        return receiveBatch(maxMessages, waitTime, Mono.never());
    }

    /**
     * Receive like {@link #receiveBatch(int, Duration)}, but stop waiting as soon as
     * {@code stopWaiting} signals. A claim already in progress is never abandoned:
     * whatever it claimed is returned even after the signal.
     *
     * @param maxMessages maximum messages to claim
     * @param waitTime long-poll wait, zero for a single attempt
     * @param stopWaiting ends the wait between attempts
     * @return Mono with the claimed messages, empty list if none arrived in time
     */
    Mono<List<QueueMessage>> receiveBatch(int maxMessages, Duration waitTime, Publisher<?> stopWaiting);

    /**
     * Acknowledge a message, permanently removing it
     *
     * @param claimHandle handle from the receipt
     * @return Mono with true if deleted, false if the claim had expired or was superseded
     */
    Mono<Boolean> delete(String claimHandle);

    /**
     * Deliveries of this message so far, the current one included
     */
    default int approximateReceiveCount(QueueMessage message) {
        return message.getReceiveCount();
    }

    /**
     * Messages currently held, visible or claimed
     */
    Mono<Long> approximateDepth();
}
