package com.whereq.forge.worker;

import com.whereq.forge.config.ForgeProperties;
import com.whereq.forge.model.JobType;
import com.whereq.forge.queue.JobQueue;
import com.whereq.forge.queue.JobQueueRegistry;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs one {@link QueueWorker} per configured queue for the lifetime of the application
 */
@Slf4j
@Component
public class WorkerManager {

    @Autowired
    private JobQueueRegistry queueRegistry;

    @Autowired
    private JobMessageProcessor processor;

    @Autowired
    private ForgeProperties properties;

    @Autowired
    private MeterRegistry meterRegistry;

    private final List<QueueWorker> workers = new CopyOnWriteArrayList<>();

    @PostConstruct
    public void startWorkers() {
        if (!properties.getWorker().isEnabled()) {
            log.info("Queue workers disabled in this process");
            return;
        }

        for (JobQueue queue : queueRegistry.all()) {
            QueueWorker worker = new QueueWorker(queue, processor, properties.getQueue(),
                properties.getWorker().getConcurrency());
            workers.add(worker);
            worker.start();
        }

        Gauge.builder("forge.worker.running", workers, list -> list.stream().filter(QueueWorker::isRunning).count())
            .description("Queue workers currently polling")
            .register(meterRegistry);

        log.info("Started {} queue worker(s)", workers.size());
    }

    /**
     * Stop every worker, then give them a shared drain window
     */
    @PreDestroy
    public void stopWorkers() {
        if (workers.isEmpty()) {
            return;
        }

        workers.forEach(QueueWorker::stop);

        Instant deadline = Instant.now().plus(properties.getWorker().getDrainTimeout());
        int abandoned = 0;
        for (QueueWorker worker : workers) {
            Duration remaining = Duration.between(Instant.now(), deadline);
            if (!worker.awaitTermination(remaining.isNegative() ? Duration.ZERO : remaining)) {
                abandoned++;
            }
        }

        if (abandoned > 0) {
            log.warn("{} queue worker(s) abandoned in-flight messages at shutdown", abandoned);
        } else {
            log.info("All queue workers drained");
        }
    }

    /**
     * Running state per job type that has a worker
     */
    public Map<JobType, Boolean> getWorkerStates() {
        Map<JobType, Boolean> states = new EnumMap<>(JobType.class);
        for (QueueWorker worker : workers) {
            states.put(worker.getQueue().getType(), worker.isRunning());
        }
        return states;
    }

    public boolean isEnabled() {
        return properties.getWorker().isEnabled();
    }
}
