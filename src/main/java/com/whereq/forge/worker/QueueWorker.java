package com.whereq.forge.worker;

import com.whereq.forge.config.ForgeProperties;
import com.whereq.forge.queue.JobQueue;
import com.whereq.forge.queue.QueueMessage;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Poll loop for one queue: receive a batch, process it with bounded concurrency,
 * pause for the poll interval when nothing arrived, repeat until stopped.
 *
 * Stopping ends a pending long-poll wait or pause at once. A claim in progress completes and
 * its messages, like those already being processed, run to completion unless the drain
 * timeout elapses first. A worker runs at most once.
 */
@Slf4j
public class QueueWorker {

    private final JobQueue queue;
    private final JobMessageProcessor processor;
    private final ForgeProperties.QueueConfig queueConfig;
    private final int concurrency;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Sinks.One<Boolean> stopSignal = Sinks.one();
    private final CountDownLatch terminated = new CountDownLatch(1);

    private volatile Disposable subscription;

    public QueueWorker(JobQueue queue, JobMessageProcessor processor,
                       ForgeProperties.QueueConfig queueConfig, int concurrency) {
        this.queue = queue;
        this.processor = processor;
        this.queueConfig = queueConfig;
        this.concurrency = Math.max(1, concurrency);
    }

    public synchronized void start() {
        if (subscription != null) {
            throw new IllegalStateException("Worker for " + queue.getType().getValue() + " queue was already started");
        }
        running.set(true);

        log.info("Starting worker for {} queue (concurrency {}, max {} messages per receive)",
            queue.getType().getValue(), concurrency, queueConfig.getMaxMessages());

        subscription = Flux.defer(this::pollOnce)
            .repeat(running::get)
            .doFinally(signal -> {
                running.set(false);
                terminated.countDown();
                log.info("Worker for {} queue stopped ({})", queue.getType().getValue(), signal);
            })
            .subscribe(
                outcome -> log.debug("Message on {} queue: {}", queue.getType().getValue(), outcome),
                error -> log.error("Worker for {} queue terminated unexpectedly", queue.getType().getValue(), error));
    }

    /**
     * Stop receiving; in-flight messages keep running
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Stopping worker for {} queue", queue.getType().getValue());
        }
        stopSignal.tryEmitValue(Boolean.TRUE);
    }

    /**
     * Wait for in-flight messages after {@link #stop()}, abandoning them when the timeout elapses.
     * Abandoned messages are redelivered once their visibility timeout ends.
     *
     * @return true if the worker finished within the timeout
     */
    public boolean awaitTermination(Duration timeout) {
        if (subscription == null) {
            return true;
        }
        boolean drained;
        try {
            drained = terminated.await(Math.max(0, timeout.toMillis()), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            drained = false;
        }
        if (!drained) {
            log.warn("Worker for {} queue did not drain within {}, abandoning in-flight messages",
                queue.getType().getValue(), timeout);
            subscription.dispose();
        }
        return drained;
    }

    public boolean isRunning() {
        return running.get();
    }

    public JobQueue getQueue() {
        return queue;
    }

    private Flux<MessageOutcome> pollOnce() {
        // The stop signal only ends the wait; messages claimed before it are still processed
        return queue.receiveBatch(queueConfig.getMaxMessages(), queueConfig.getWaitTime(), stopSignal.asMono())
            .onErrorResume(e -> {
                log.error("Receive from {} queue failed: {}", queue.getType().getValue(), e.getMessage());
                return Mono.just(Collections.<QueueMessage>emptyList());
            })
            .flatMapMany(batch -> batch.isEmpty() ? pause() : processBatch(batch));
    }

    private Flux<MessageOutcome> processBatch(List<QueueMessage> batch) {
        log.debug("Received {} message(s) from {} queue", batch.size(), queue.getType().getValue());
        return Flux.fromIterable(batch)
            .flatMap(message -> processor.process(queue, message), concurrency);
    }

    private Flux<MessageOutcome> pause() {
        return Mono.delay(queueConfig.getPollInterval())
            .takeUntilOther(stopSignal.asMono())
            .thenMany(Flux.empty());
    }
}
