package com.whereq.forge.queue;

import com.whereq.forge.model.JobType;
import com.whereq.forge.support.RedisTestContainer;
import com.whereq.forge.support.TestJobs;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the Redis job queue and its Lua scripts against a real Redis
 */
@Tag("integration")
@Testcontainers(disabledWithoutDocker = true)
class RedisJobQueueTest {

    private static final Duration VISIBILITY = Duration.ofMillis(300);

    @Container
    private static final GenericContainer<?> REDIS = RedisTestContainer.create();

    private static LettuceConnectionFactory connectionFactory;
    private static ReactiveRedisTemplate<String, String> redisTemplate;

    private RedisJobQueue queue;

    @BeforeAll
    static void connect() {
        connectionFactory = RedisTestContainer.connect(REDIS);
        redisTemplate = RedisTestContainer.template(connectionFactory);
    }

    @AfterAll
    static void disconnect() {
        if (connectionFactory != null) {
            connectionFactory.destroy();
        }
    }

    @BeforeEach
    void setUp() {
        RedisTestContainer.flush(connectionFactory);
        queue = new RedisJobQueue(JobType.IMAGE, redisTemplate, TestJobs.MAPPER, VISIBILITY, Duration.ofMillis(20));
    }

    @Test
    void receivedMessageIsDeletedByItsClaim() throws Exception {
        String messageId = queue.enqueue(body("job-1")).block();

        List<QueueMessage> batch = queue.receiveBatch(10, Duration.ZERO).block();

        assertThat(batch).hasSize(1);
        QueueMessage message = batch.get(0);
        assertThat(message.getMessageId()).isEqualTo(messageId);
        assertThat(message.getReceiveCount()).isEqualTo(1);
        QueueMessageBody parsed = TestJobs.MAPPER.readValue(message.getBody(), QueueMessageBody.class);
        assertThat(parsed.getJobId()).isEqualTo("job-1");
        assertThat(parsed.getPayload().path("prompt").asText()).isEqualTo("a red kite");

        StepVerifier.create(queue.delete(message.getClaimHandle())).expectNext(true).verifyComplete();
        StepVerifier.create(queue.approximateDepth()).expectNext(0L).verifyComplete();
        assertThat(redisTemplate.opsForHash().size("forge:queue:image:bodies").block()).isZero();
        assertThat(redisTemplate.opsForHash().size("forge:queue:image:receives").block()).isZero();
    }

    @Test
    void receiveHonoursMaxMessages() {
        queue.enqueue(body("job-1")).block();
        queue.enqueue(body("job-2")).block();
        queue.enqueue(body("job-3")).block();

        assertThat(queue.receiveBatch(2, Duration.ZERO).block()).hasSize(2);
        assertThat(queue.receiveBatch(10, Duration.ZERO).block()).hasSize(1);
        assertThat(queue.receiveBatch(10, Duration.ZERO).block()).isEmpty();
    }

    @Test
    @DisplayName("a message is redelivered after its visibility window with the receive count incremented")
    void messageIsRedeliveredAfterVisibilityWindow() throws InterruptedException {
        queue.enqueue(body("job-1")).block();
        QueueMessage first = queue.receiveBatch(10, Duration.ZERO).block().get(0);

        assertThat(queue.receiveBatch(10, Duration.ZERO).block()).isEmpty();

        Thread.sleep(VISIBILITY.toMillis() + 100);
        List<QueueMessage> redelivered = queue.receiveBatch(10, Duration.ZERO).block();

        assertThat(redelivered).hasSize(1);
        QueueMessage second = redelivered.get(0);
        assertThat(second.getMessageId()).isEqualTo(first.getMessageId());
        assertThat(second.getReceiveCount()).isEqualTo(2);
        assertThat(queue.approximateReceiveCount(second)).isEqualTo(2);
        assertThat(second.getClaimHandle()).isNotEqualTo(first.getClaimHandle());

        // Superseded claim
        StepVerifier.create(queue.delete(first.getClaimHandle())).expectNext(false).verifyComplete();
        StepVerifier.create(queue.delete(second.getClaimHandle())).expectNext(true).verifyComplete();
    }

    @Test
    @DisplayName("an expired claim fails to delete and the message stays queued")
    void expiredClaimCannotDelete() throws InterruptedException {
        queue.enqueue(body("job-1")).block();
        QueueMessage claimed = queue.receiveBatch(10, Duration.ZERO).block().get(0);

        Thread.sleep(VISIBILITY.toMillis() + 100);

        StepVerifier.create(queue.delete(claimed.getClaimHandle())).expectNext(false).verifyComplete();
        StepVerifier.create(queue.approximateDepth()).expectNext(1L).verifyComplete();
        assertThat(queue.receiveBatch(10, Duration.ZERO).block())
            .singleElement()
            .satisfies(message -> assertThat(message.getReceiveCount()).isEqualTo(2));
    }

    @Test
    void longPollReturnsMessageEnqueuedWhileWaiting() {
        Mono<List<QueueMessage>> receive = queue.receiveBatch(10, Duration.ofSeconds(5));

        StepVerifier.create(receive)
            .then(() -> queue.enqueue(body("job-1")).delaySubscription(Duration.ofMillis(100)).subscribe())
            .assertNext(batch -> assertThat(batch).hasSize(1))
            .verifyComplete();
    }

    @Test
    void longPollEndsEmptyWhenNothingArrives() {
        StepVerifier.create(queue.receiveBatch(10, Duration.ofMillis(200)))
            .assertNext(batch -> assertThat(batch).isEmpty())
            .verifyComplete();
    }

    private static QueueMessageBody body(String jobId) {
        return QueueMessageBody.builder()
            .jobId(jobId)
            .type(JobType.IMAGE)
            .payload(TestJobs.imagePayloadJson("a red kite"))
            .enqueuedAt(Instant.parse("2026-03-01T10:00:00Z"))
            .build();
    }
}
