package com.whereq.forge.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.forge.model.JobType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Redis-based job queue with visibility timeouts.
 *
 * A sorted set scores every message id by the time it next becomes visible; bodies and
 * receive counts live in two hashes. Receive and delete are Lua scripts, so claiming a
 * message and checking a claim are atomic across any number of worker processes.
 * Visibility is measured against the Redis server clock.
 */
@Slf4j
public class RedisJobQueue extends AbstractPollingJobQueue {

    private static final String QUEUE_KEY_PREFIX = "forge:queue:";

    private static final RedisScript<Long> ENQUEUE_SCRIPT =
        RedisScript.of(new ClassPathResource("scripts/queue-enqueue.lua"), Long.class);
    private static final RedisScript<String> RECEIVE_SCRIPT =
        RedisScript.of(new ClassPathResource("scripts/queue-receive.lua"), String.class);
    private static final RedisScript<Long> DELETE_SCRIPT =
        RedisScript.of(new ClassPathResource("scripts/queue-delete.lua"), Long.class);

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final String visibilityKey;
    private final String bodiesKey;
    private final String receivesKey;

    public RedisJobQueue(JobType type, ReactiveRedisTemplate<String, String> redisTemplate,
                         ObjectMapper objectMapper, Duration visibilityTimeout, Duration longPollStep) {
        super(type, objectMapper, visibilityTimeout, longPollStep);
        this.redisTemplate = redisTemplate;

        String prefix = QUEUE_KEY_PREFIX + type.getValue() + ":";
        this.visibilityKey = prefix + "visibility";
        this.bodiesKey = prefix + "bodies";
        this.receivesKey = prefix + "receives";
    }

    @Override
    protected Mono<Void> store(String messageId, String body) {
        return redisTemplate.execute(ENQUEUE_SCRIPT, List.of(visibilityKey, bodiesKey), List.of(messageId, body))
            .then();
    }

    @Override
    protected Mono<List<QueueMessage>> claimVisible(int maxMessages) {
        List<String> args = List.of(
            String.valueOf(visibilityTimeout.toMillis()),
            String.valueOf(maxMessages));

        return redisTemplate.execute(RECEIVE_SCRIPT, List.of(visibilityKey, bodiesKey, receivesKey), args)
            .next()
            .map(this::parseClaims)
            .defaultIfEmpty(List.of());
    }

    @Override
    protected Mono<Boolean> remove(String messageId, int receiveCount) {
        return redisTemplate.execute(DELETE_SCRIPT, List.of(visibilityKey, bodiesKey, receivesKey),
                List.of(messageId, String.valueOf(receiveCount)))
            .next()
            .map(result -> result == 1L)
            .defaultIfEmpty(false);
    }

    @Override
    public Mono<Long> approximateDepth() {
        return redisTemplate.opsForZSet()
            .size(visibilityKey)
            .defaultIfEmpty(0L);
    }

    private List<QueueMessage> parseClaims(String json) {
        try {
            JsonNode claims = objectMapper.readTree(json);
            List<QueueMessage> batch = new ArrayList<>();
            for (JsonNode claim : claims) {
                batch.add(claimed(claim.path("id").asText(), claim.path("count").asInt(), claim.path("body").asText()));
            }
            if (!batch.isEmpty()) {
                log.debug("Claimed {} message(s) from {} queue", batch.size(), type.getValue());
            }
            return batch;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable receive result from " + type.getValue() + " queue", e);
        }
    }
}
