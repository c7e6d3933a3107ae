package com.whereq.forge.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.forge.model.JobType;
import com.whereq.forge.queue.InMemoryJobQueue;
import com.whereq.forge.queue.JobQueue;
import com.whereq.forge.queue.JobQueueRegistry;
import com.whereq.forge.queue.RedisJobQueue;
import com.whereq.forge.store.InMemoryJobStore;
import com.whereq.forge.store.JobStore;
import com.whereq.forge.store.RedisJobStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.ReactiveRedisTemplate;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Wires the job store and the per-type job queues from {@link ForgeProperties}
 */
@Slf4j
@Configuration
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public JobStore jobStore(ForgeProperties properties,
                             ObjectProvider<ReactiveRedisTemplate<String, String>> redisTemplate,
                             ObjectMapper objectMapper) {
        ForgeProperties.StoreConfig config = properties.getStore();
        log.info("Using {} job store", config.getType());

        return switch (config.getType()) {
            case REDIS -> new RedisJobStore(redisTemplate.getObject(), objectMapper, config.getRetention());
            case MEMORY -> new InMemoryJobStore();
        };
    }

    @Bean
    public JobQueueRegistry jobQueueRegistry(ForgeProperties properties,
                                             ObjectProvider<ReactiveRedisTemplate<String, String>> redisTemplate,
                                             ObjectMapper objectMapper,
                                             Clock clock) {
        ForgeProperties.QueueConfig config = properties.getQueue();
        List<JobQueue> queues = new ArrayList<>();

        if (config.getBackend() != ForgeProperties.QueueBackend.NONE && !properties.visibilityCoversGeneration()) {
            log.warn("Queue visibility timeout {} does not exceed generation timeout {}; "
                    + "slow generations will be redelivered while still running",
                config.getVisibilityTimeout(), properties.getGeneration().getTimeout());
        }

        for (JobType type : JobType.values()) {
            if (!config.isEnabled(type)) {
                log.info("No queue for {} jobs, submissions will be generated synchronously", type.getValue());
                continue;
            }

            JobQueue queue = switch (config.getBackend()) {
                case REDIS -> new RedisJobQueue(type, redisTemplate.getObject(), objectMapper,
                    config.getVisibilityTimeout(), config.getLongPollStep());
                case MEMORY -> new InMemoryJobQueue(type, objectMapper,
                    config.getVisibilityTimeout(), config.getLongPollStep(), clock);
                case NONE -> throw new IllegalStateException("Queue backend NONE has no queues");
            };
            log.info("Configured {} queue for {} jobs", config.getBackend(), type.getValue());
            queues.add(queue);
        }

        return new JobQueueRegistry(queues);
    }
}
