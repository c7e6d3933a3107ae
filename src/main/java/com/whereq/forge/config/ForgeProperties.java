package com.whereq.forge.config;

import com.whereq.forge.model.JobType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Configuration properties for WhereQ Forge.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "forge")
@Data
public class ForgeProperties {

    private StoreConfig store = new StoreConfig();

    private QueueConfig queue = new QueueConfig();

    private WorkerConfig worker = new WorkerConfig();

    private SubmissionConfig submission = new SubmissionConfig();

    private GenerationConfig generation = new GenerationConfig();

    @Data
    public static class StoreConfig {
        /**
         * Job store backend.
         * REDIS: shared store for any number of API and worker processes (default)
         * MEMORY: process-local store for development and single-node deployments
         */
        private StoreType type = StoreType.REDIS;

        /**
         * How long job records are kept after creation.
         */
        private Duration retention = Duration.ofDays(7);
    }

    @Data
    public static class QueueConfig {
        /**
         * Queue backend. NONE disables queuing; every submission is generated synchronously.
         */
        private QueueBackend backend = QueueBackend.REDIS;

        /**
         * Job types that get a queue. Types left out are generated synchronously.
         */
        private Set<JobType> types = EnumSet.allOf(JobType.class);

        /**
         * Pause between receive calls that returned nothing.
         */
        private Duration pollInterval = Duration.ofSeconds(3);

        /**
         * Maximum messages per receive call.
         */
        private int maxMessages = 10;

        /**
         * How long a received message stays hidden from other receivers.
         * Keep it above {@code forge.generation.timeout}, or a slow generation is
         * redelivered to another worker while the first is still running.
         */
        private Duration visibilityTimeout = Duration.ofMinutes(35);

        /**
         * Long-poll wait for a receive call.
         */
        private Duration waitTime = Duration.ofSeconds(20);

        /**
         * Re-check interval while long-polling.
         */
        private Duration longPollStep = Duration.ofMillis(500);

        /**
         * Deliveries after which a job is failed as exhausted.
         */
        private int maxReceives = 5;

        public boolean isEnabled(JobType type) {
            return backend != QueueBackend.NONE && types.contains(type);
        }
    }

    @Data
    public static class WorkerConfig {
        /**
         * Run the queue workers in this process.
         */
        private boolean enabled = true;

        /**
         * Messages processed in parallel per queue. 1 processes each batch sequentially.
         */
        private int concurrency = 1;

        /**
         * How long shutdown waits for in-flight messages before abandoning them.
         */
        private Duration drainTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class SubmissionConfig {
        /**
         * Queued plus processing jobs a single user may hold.
         */
        private int maxActiveJobsPerUser = 5;
    }

    @Data
    public static class GenerationConfig {
        /**
         * Base URL of the generation backend.
         */
        private String baseUrl = "http://localhost:8000";

        /**
         * Upper bound for one generation call.
         */
        private Duration timeout = Duration.ofMinutes(30);
    }

    /**
     * Check that a claimed message stays hidden for the whole generation call
     */
    public boolean visibilityCoversGeneration() {
        return queue.getVisibilityTimeout().compareTo(generation.getTimeout()) > 0;
    }

    public enum StoreType {
        REDIS,
        MEMORY
    }

    public enum QueueBackend {
        REDIS,
        MEMORY,
        NONE
    }
}
