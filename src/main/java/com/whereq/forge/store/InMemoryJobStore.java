package com.whereq.forge.store;

import com.whereq.forge.exception.JobNotFoundException;
import com.whereq.forge.model.Job;
import com.whereq.forge.model.JobStatus;
import com.whereq.forge.model.JobUpdate;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local job store for development and single-node deployments.
 * Conditional writes are atomic per job through {@link ConcurrentHashMap#computeIfPresent}.
 */
@Slf4j
public class InMemoryJobStore implements JobStore {

    private final ConcurrentHashMap<String, Job> jobs = new ConcurrentHashMap<>();

    @Override
    public Mono<Job> create(Job job) {
        return Mono.fromCallable(() -> {
            Job stored = job.toBuilder().build();
            if (jobs.putIfAbsent(stored.getId(), stored) != null) {
                throw new IllegalStateException("Job already exists: " + stored.getId());
            }
            log.debug("Created job {} ({}, {})", stored.getId(), stored.getType(), stored.getStatus());
            return stored.toBuilder().build();
        });
    }

    @Override
    public Mono<Job> get(String jobId) {
        return Mono.fromCallable(() -> {
            Job job = jobs.get(jobId);
            return job != null ? job.toBuilder().build() : null;
        });
    }

    @Override
    public Mono<Boolean> compareAndSetStatus(String jobId, Set<JobStatus> expected, JobStatus newStatus, JobUpdate update) {
        return Mono.fromCallable(() -> {
            JobStore.checkTransition(expected, newStatus, update);

            AtomicBoolean applied = new AtomicBoolean(false);
            Job updated = jobs.computeIfPresent(jobId, (id, current) -> {
                if (!expected.contains(current.getStatus())) {
                    return current;
                }
                applied.set(true);
                return current.withTransition(newStatus, update);
            });

            if (updated == null) {
                throw new JobNotFoundException(jobId);
            }
            return applied.get();
        });
    }

    @Override
    public Mono<Long> countActiveForUser(String userId) {
        return Mono.fromCallable(() -> jobs.values().stream()
            .filter(job -> userId.equals(job.getUserId()))
            .filter(job -> job.getStatus().isActive())
            .count());
    }

    @Override
    public Flux<Job> listForUser(String userId) {
        return Flux.defer(() -> Flux.fromStream(jobs.values().stream()
            .filter(job -> userId.equals(job.getUserId()))
            .sorted(Comparator.comparing(Job::getCreatedAt).reversed())
            .map(job -> job.toBuilder().build())));
    }

    @Override
    public Mono<Boolean> deleteIfStatus(String jobId, Set<JobStatus> allowed) {
        return Mono.fromCallable(() -> {
            Job current = jobs.get(jobId);
            if (current == null) {
                throw new JobNotFoundException(jobId);
            }
            // Conditional remove fails if another writer replaced the job meanwhile
            return allowed.contains(current.getStatus()) && jobs.remove(jobId, current);
        });
    }
}
