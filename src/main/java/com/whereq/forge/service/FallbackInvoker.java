package com.whereq.forge.service;

import com.whereq.forge.generation.GenerationExecutor;
import com.whereq.forge.model.Job;
import com.whereq.forge.model.JobStatus;
import com.whereq.forge.store.JobStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

/**
 * Generates a job synchronously when its type has no queue.
 *
 * The job is stored once, already terminal, so it is never observable as queued.
 * A transient failure is final here since no queue will redeliver it.
 */
@Slf4j
@Service
public class FallbackInvoker {

    @Autowired
    private GenerationExecutor generationExecutor;

    @Autowired
    private JobStore jobStore;

    @Autowired
    private Clock clock;

    /**
     * Run the generation for a job that has not been stored yet
     *
     * @param job new job with id, type, user, payload and creation time set
     * @return Mono with the stored terminal job
     */
    public Mono<Job> invoke(Job job) {
        Instant startedAt = clock.instant();
        log.info("Generating {} job {} synchronously for user {}", job.getType().getValue(), job.getId(), job.getUserId());

        return generationExecutor.execute(job.getId(), job.getType(), job.getPayload())
            .map(outcome -> job.toBuilder()
                .status(JobStatus.PROCESSING)
                .attempts(1)
                .startedAt(startedAt)
                .build()
                .withTransition(outcome.terminalStatus(), outcome.terminalUpdate(clock.instant())))
            .flatMap(jobStore::create)
            .doOnSuccess(stored -> log.info("Job {} finished synchronously as {}", stored.getId(), stored.getStatus()));
    }
}
