package com.whereq.forge.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.forge.model.JobType;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Process-local queue with the same visibility-timeout semantics as {@link RedisJobQueue}.
 * Messages are offered in insertion order, but a redelivered message keeps its original position.
 */
public class InMemoryJobQueue extends AbstractPollingJobQueue {

    private final Clock clock;
    private final Map<String, StoredMessage> messages = new LinkedHashMap<>();

    public InMemoryJobQueue(JobType type, ObjectMapper objectMapper, Duration visibilityTimeout,
                            Duration longPollStep, Clock clock) {
        super(type, objectMapper, visibilityTimeout, longPollStep);
        this.clock = clock;
    }

    @Override
    protected Mono<Void> store(String messageId, String body) {
        return Mono.fromRunnable(() -> {
            synchronized (messages) {
                messages.put(messageId, new StoredMessage(body, clock.instant()));
            }
        });
    }

    @Override
    protected Mono<List<QueueMessage>> claimVisible(int maxMessages) {
        return Mono.fromCallable(() -> {
            Instant now = clock.instant();
            List<QueueMessage> batch = new ArrayList<>();
            synchronized (messages) {
                for (Map.Entry<String, StoredMessage> entry : messages.entrySet()) {
                    if (batch.size() >= maxMessages) {
                        break;
                    }
                    StoredMessage message = entry.getValue();
                    if (message.visibleAt.isAfter(now)) {
                        continue;
                    }
                    message.receiveCount++;
                    message.visibleAt = now.plus(visibilityTimeout);
                    batch.add(claimed(entry.getKey(), message.receiveCount, message.body));
                }
            }
            return batch;
        });
    }

    @Override
    protected Mono<Boolean> remove(String messageId, int receiveCount) {
        return Mono.fromCallable(() -> {
            Instant now = clock.instant();
            synchronized (messages) {
                StoredMessage message = messages.get(messageId);
                if (message == null || message.receiveCount != receiveCount || !message.visibleAt.isAfter(now)) {
                    return false;
                }
                messages.remove(messageId);
                return true;
            }
        });
    }

    @Override
    public Mono<Long> approximateDepth() {
        return Mono.fromCallable(() -> {
            synchronized (messages) {
                return (long) messages.size();
            }
        });
    }

    private static final class StoredMessage {
        private final String body;
        private Instant visibleAt;
        private int receiveCount;

        private StoredMessage(String body, Instant visibleAt) {
            this.body = body;
            this.visibleAt = visibleAt;
        }
    }
}
