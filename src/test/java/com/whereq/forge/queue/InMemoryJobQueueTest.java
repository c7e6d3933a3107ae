package com.whereq.forge.queue;

import com.whereq.forge.model.JobType;
import com.whereq.forge.support.MutableClock;
import com.whereq.forge.support.TestJobs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryJobQueueTest {

    private static final Duration VISIBILITY = Duration.ofMinutes(10);

    private MutableClock clock;
    private InMemoryJobQueue queue;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        queue = new InMemoryJobQueue(JobType.IMAGE, TestJobs.MAPPER, VISIBILITY, Duration.ofMillis(10), clock);
    }

    @Test
    void receivedMessageCarriesTheEnqueuedBody() throws Exception {
        queue.enqueue(body("job-1")).block();

        List<QueueMessage> batch = queue.receiveBatch(10, Duration.ZERO).block();

        assertThat(batch).hasSize(1);
        QueueMessage message = batch.get(0);
        assertThat(message.getReceiveCount()).isEqualTo(1);
        assertThat(queue.approximateReceiveCount(message)).isEqualTo(1);

        QueueMessageBody parsed = TestJobs.MAPPER.readValue(message.getBody(), QueueMessageBody.class);
        assertThat(parsed.getJobId()).isEqualTo("job-1");
        assertThat(parsed.getType()).isEqualTo(JobType.IMAGE);
        assertThat(parsed.getPayload().path("prompt").asText()).isEqualTo("a red kite");
        assertThat(message.getBody()).contains("\"enqueuedAt\":\"2026-03-01T10:00:00Z\"");
    }

    @Test
    @DisplayName("a claimed message is hidden until its visibility timeout elapses, then redelivered")
    void claimedMessageIsHiddenUntilVisibilityExpires() {
        queue.enqueue(body("job-1")).block();
        QueueMessage first = queue.receiveBatch(10, Duration.ZERO).block().get(0);

        assertThat(queue.receiveBatch(10, Duration.ZERO).block()).isEmpty();

        clock.advance(VISIBILITY.plusSeconds(1));
        List<QueueMessage> redelivered = queue.receiveBatch(10, Duration.ZERO).block();

        assertThat(redelivered).hasSize(1);
        assertThat(redelivered.get(0).getMessageId()).isEqualTo(first.getMessageId());
        assertThat(redelivered.get(0).getReceiveCount()).isEqualTo(2);
        assertThat(redelivered.get(0).getClaimHandle()).isNotEqualTo(first.getClaimHandle());
    }

    @Test
    @DisplayName("only the current, unexpired claim can delete a message")
    void staleClaimCannotDelete() {
        queue.enqueue(body("job-1")).block();
        QueueMessage first = queue.receiveBatch(10, Duration.ZERO).block().get(0);
        clock.advance(VISIBILITY.plusSeconds(1));

        // Expired claim
        StepVerifier.create(queue.delete(first.getClaimHandle())).expectNext(false).verifyComplete();

        QueueMessage second = queue.receiveBatch(10, Duration.ZERO).block().get(0);

        // Superseded claim
        StepVerifier.create(queue.delete(first.getClaimHandle())).expectNext(false).verifyComplete();
        StepVerifier.create(queue.delete(second.getClaimHandle())).expectNext(true).verifyComplete();
        StepVerifier.create(queue.delete(second.getClaimHandle())).expectNext(false).verifyComplete();
        StepVerifier.create(queue.approximateDepth()).expectNext(0L).verifyComplete();
    }

    @Test
    void batchIsLimitedToMaxMessages() {
        for (int i = 0; i < 5; i++) {
            queue.enqueue(body("job-" + i)).block();
        }

        assertThat(queue.receiveBatch(3, Duration.ZERO).block()).hasSize(3);
        assertThat(queue.receiveBatch(3, Duration.ZERO).block()).hasSize(2);
        assertThat(queue.receiveBatch(3, Duration.ZERO).block()).isEmpty();
        StepVerifier.create(queue.approximateDepth()).expectNext(5L).verifyComplete();
    }

    @Test
    void longPollReturnsEmptyWhenNothingArrives() {
        StepVerifier.create(queue.receiveBatch(10, Duration.ofMillis(100)))
            .assertNext(batch -> assertThat(batch).isEmpty())
            .verifyComplete();
    }

    @Test
    void longPollPicksUpMessageEnqueuedWhileWaiting() {
        StepVerifier.create(queue.receiveBatch(10, Duration.ofSeconds(5)))
            .then(() -> queue.enqueue(body("late-job")).block())
            .assertNext(batch -> assertThat(batch).hasSize(1))
            .verifyComplete();
    }

    @Test
    void malformedClaimHandleIsRejected() {
        StepVerifier.create(queue.delete("no-separator"))
            .expectError(IllegalArgumentException.class)
            .verify();
    }

    @Test
    @DisplayName("a claim that runs past the wait time still delivers its messages")
    void slowClaimOutlastingWaitIsDelivered() {
        InMemoryJobQueue slowQueue = slowClaimQueue(Duration.ofMillis(200));
        slowQueue.enqueue(body("job-1")).block();

        List<QueueMessage> batch = slowQueue.receiveBatch(10, Duration.ofMillis(100)).block(Duration.ofSeconds(5));

        assertThat(batch).hasSize(1);
        assertThat(batch.get(0).getReceiveCount()).isEqualTo(1);
        StepVerifier.create(slowQueue.delete(batch.get(0).getClaimHandle())).expectNext(true).verifyComplete();
    }

    @Test
    void stopSignalDuringClaimKeepsClaimedMessages() {
        InMemoryJobQueue slowQueue = slowClaimQueue(Duration.ofMillis(200));
        slowQueue.enqueue(body("job-1")).block();

        List<QueueMessage> batch = slowQueue
            .receiveBatch(10, Duration.ofSeconds(30), Mono.delay(Duration.ofMillis(50)))
            .block(Duration.ofSeconds(5));

        assertThat(batch).hasSize(1);
        assertThat(batch.get(0).getReceiveCount()).isEqualTo(1);
    }

    @Test
    void stopSignalEndsAnEmptyWait() {
        long started = System.nanoTime();

        List<QueueMessage> batch = queue
            .receiveBatch(10, Duration.ofSeconds(30), Mono.delay(Duration.ofMillis(50)))
            .block(Duration.ofSeconds(5));

        assertThat(batch).isEmpty();
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(2));
    }

    private static QueueMessageBody body(String jobId) {
        return QueueMessageBody.builder()
            .jobId(jobId)
            .type(JobType.IMAGE)
            .payload(TestJobs.imagePayloadJson("a red kite"))
            .enqueuedAt(Instant.parse("2026-03-01T10:00:00Z"))
            .build();
    }

    private InMemoryJobQueue slowClaimQueue(Duration claimLatency) {
        return new InMemoryJobQueue(JobType.IMAGE, TestJobs.MAPPER, VISIBILITY, Duration.ofMillis(10), clock) {
            @Override
            protected Mono<List<QueueMessage>> claimVisible(int maxMessages) {
                return super.claimVisible(maxMessages).delayElement(claimLatency);
            }
        };
    }
}
