package com.whereq.forge.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.forge.exception.JobNotFoundException;
import com.whereq.forge.model.GenerationResult;
import com.whereq.forge.model.Job;
import com.whereq.forge.model.JobError;
import com.whereq.forge.model.JobStatus;
import com.whereq.forge.model.JobType;
import com.whereq.forge.model.JobUpdate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Job store in Redis.
 *
 * Each job is a hash at {@code forge:job:{id}}. Creation, status transitions and deletion
 * run as Lua scripts, so a job and its index entries change in one atomic operation.
 * A per-user set of active job ids backs the quota count and a per-user sorted set
 * (scored by creation time) backs listing. Both indexes are pruned of ids whose hash
 * has become terminal or expired.
 */
@Slf4j
public class RedisJobStore implements JobStore {

    private static final String JOB_KEY_PREFIX = "forge:job:";
    private static final String USER_ACTIVE_KEY_PREFIX = "forge:user:active:";
    private static final String USER_JOBS_KEY_PREFIX = "forge:user:jobs:";

    private static final RedisScript<Long> CREATE_SCRIPT =
        RedisScript.of(new ClassPathResource("scripts/job-create.lua"), Long.class);
    private static final RedisScript<Long> COMPARE_AND_SET_SCRIPT =
        RedisScript.of(new ClassPathResource("scripts/job-compare-and-set.lua"), Long.class);
    private static final RedisScript<Long> COUNT_ACTIVE_SCRIPT =
        RedisScript.of(new ClassPathResource("scripts/job-count-active.lua"), Long.class);
    private static final RedisScript<Long> DELETE_SCRIPT =
        RedisScript.of(new ClassPathResource("scripts/job-delete.lua"), Long.class);

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration retention;

    public RedisJobStore(ReactiveRedisTemplate<String, String> redisTemplate,
                         ObjectMapper objectMapper,
                         Duration retention) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.retention = retention;
    }

    @Override
    public Mono<Job> create(Job job) {
        List<String> keys = List.of(
            JOB_KEY_PREFIX + job.getId(),
            USER_JOBS_KEY_PREFIX + job.getUserId(),
            USER_ACTIVE_KEY_PREFIX + job.getUserId());

        return Mono.fromCallable(() -> createArgs(job))
            .flatMap(args -> redisTemplate.execute(CREATE_SCRIPT, keys, args).next())
            .flatMap(created -> {
                if (created != 1L) {
                    return Mono.error(new IllegalStateException("Job already exists: " + job.getId()));
                }
                log.debug("Created job {} ({}, {})", job.getId(), job.getType(), job.getStatus());
                return Mono.just(job);
            });
    }

    @Override
    public Mono<Job> get(String jobId) {
        return redisTemplate.opsForHash()
            .entries(JOB_KEY_PREFIX + jobId)
            .collectMap(entry -> (String) entry.getKey(), entry -> (String) entry.getValue())
            .filter(fields -> !fields.isEmpty())
            .map(this::fromHash);
    }

    @Override
    public Mono<Boolean> compareAndSetStatus(String jobId, Set<JobStatus> expected, JobStatus newStatus, JobUpdate update) {
        return Mono.fromCallable(() -> {
                JobStore.checkTransition(expected, newStatus, update);
                return compareAndSetArgs(expected, newStatus, update);
            })
            .flatMap(args -> redisTemplate.execute(COMPARE_AND_SET_SCRIPT, List.of(JOB_KEY_PREFIX + jobId), args).next())
            .flatMap(code -> {
                if (code < 0) {
                    return Mono.error(new JobNotFoundException(jobId));
                }
                boolean applied = code == 1L;
                if (applied) {
                    log.debug("Job {} status updated: {} -> {}", jobId, expected, newStatus);
                }
                return Mono.just(applied);
            });
    }

    @Override
    public Mono<Long> countActiveForUser(String userId) {
        return redisTemplate.execute(COUNT_ACTIVE_SCRIPT, List.of(USER_ACTIVE_KEY_PREFIX + userId), List.of(JOB_KEY_PREFIX))
            .next()
            .defaultIfEmpty(0L);
    }

    @Override
    public Flux<Job> listForUser(String userId) {
        String userJobsKey = USER_JOBS_KEY_PREFIX + userId;

        // Hashes expire on their own; drop index entries that outlived them
        return redisTemplate.opsForZSet()
            .reverseRange(userJobsKey, Range.unbounded())
            .concatMap(jobId -> get(jobId)
                .switchIfEmpty(Mono.defer(() -> redisTemplate.opsForZSet().remove(userJobsKey, jobId)
                    .doOnNext(removed -> log.debug("Dropped expired job {} from index of user {}", jobId, userId))
                    .then(Mono.<Job>empty()))));
    }

    @Override
    public Mono<Boolean> deleteIfStatus(String jobId, Set<JobStatus> allowed) {
        String allowedList = allowed.stream()
            .map(JobStatus::getValue)
            .collect(Collectors.joining(",", ",", ","));

        return redisTemplate.execute(DELETE_SCRIPT, List.of(JOB_KEY_PREFIX + jobId),
                List.of(allowedList, USER_JOBS_KEY_PREFIX, USER_ACTIVE_KEY_PREFIX))
            .next()
            .flatMap(code -> {
                if (code < 0) {
                    return Mono.error(new JobNotFoundException(jobId));
                }
                return Mono.just(code == 1L);
            });
    }

    private List<String> createArgs(Job job) {
        long createdAt = job.getCreatedAt().toEpochMilli();
        List<String> args = new ArrayList<>();
        args.add(job.getId());
        args.add(String.valueOf(createdAt));
        args.add(String.valueOf(createdAt - retention.toMillis()));
        args.add(String.valueOf(retention.toMillis()));
        args.add(job.getStatus().isActive() ? "1" : "0");
        toHash(job).forEach((field, value) -> {
            args.add(field);
            args.add(value);
        });
        return args;
    }

    private List<String> compareAndSetArgs(Set<JobStatus> expected, JobStatus newStatus, JobUpdate update) {
        String expectedList = expected.stream()
            .map(JobStatus::getValue)
            .collect(Collectors.joining(",", ",", ","));

        return List.of(
            expectedList,
            newStatus.getValue(),
            newStatus.isTerminal() ? "1" : "0",
            update.isIncrementAttempts() ? "1" : "0",
            orEmpty(update.getStartedAt()),
            orEmpty(update.getCompletedAt()),
            update.getResult() != null ? write(update.getResult()) : "",
            update.getError() != null ? write(update.getError()) : "",
            USER_ACTIVE_KEY_PREFIX
        );
    }

    private Map<String, String> toHash(Job job) {
        Map<String, String> fields = new HashMap<>();
        fields.put("id", job.getId());
        fields.put("type", job.getType().getValue());
        fields.put("userId", job.getUserId());
        fields.put("status", job.getStatus().getValue());
        fields.put("payload", write(job.getPayload()));
        fields.put("attempts", String.valueOf(job.getAttempts()));
        fields.put("createdAt", job.getCreatedAt().toString());

        if (job.getStartedAt() != null) {
            fields.put("startedAt", job.getStartedAt().toString());
        }
        if (job.getCompletedAt() != null) {
            fields.put("completedAt", job.getCompletedAt().toString());
        }
        if (job.getResult() != null) {
            fields.put("result", write(job.getResult()));
        }
        if (job.getError() != null) {
            fields.put("error", write(job.getError()));
        }
        return fields;
    }

    private Job fromHash(Map<String, String> fields) {
        JobType type = JobType.fromValue(fields.get("type"));

        return Job.builder()
            .id(fields.get("id"))
            .type(type)
            .userId(fields.get("userId"))
            .status(JobStatus.fromValue(fields.get("status")))
            .payload(read(fields.get("payload"), type.getPayloadClass()))
            .attempts(Integer.parseInt(fields.getOrDefault("attempts", "0")))
            .result(read(fields.get("result"), GenerationResult.class))
            .error(read(fields.get("error"), JobError.class))
            .createdAt(parseInstant(fields.get("createdAt")))
            .startedAt(parseInstant(fields.get("startedAt")))
            .completedAt(parseInstant(fields.get("completedAt")))
            .build();
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        if (json == null || json.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }

    private static Instant parseInstant(String value) {
        return value != null && !value.isEmpty() ? Instant.parse(value) : null;
    }

    private static String orEmpty(Instant value) {
        return value != null ? value.toString() : "";
    }
}
