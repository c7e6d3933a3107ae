package com.whereq.forge.config;

import com.whereq.forge.model.JobType;
import com.whereq.forge.queue.InMemoryJobQueue;
import com.whereq.forge.queue.JobQueueRegistry;
import com.whereq.forge.support.MutableClock;
import com.whereq.forge.support.TestJobs;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.data.redis.core.ReactiveRedisTemplate;

import java.time.Duration;
import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

@ExtendWith(OutputCaptureExtension.class)
class PipelineConfigTest {

    private final PipelineConfig config = new PipelineConfig();

    @SuppressWarnings("unchecked")
    private final ObjectProvider<ReactiveRedisTemplate<String, String>> redisTemplate = mock(ObjectProvider.class);

    @Test
    void memoryBackendBuildsQueuesForConfiguredTypes(CapturedOutput output) {
        ForgeProperties properties = memoryProperties();
        properties.getQueue().setTypes(EnumSet.of(JobType.IMAGE, JobType.VIDEO));

        JobQueueRegistry registry = config.jobQueueRegistry(properties, redisTemplate, TestJobs.MAPPER,
            MutableClock.startingAt("2026-03-01T10:00:00Z"));

        assertThat(registry.require(JobType.IMAGE)).isInstanceOf(InMemoryJobQueue.class);
        assertThat(registry.isConfigured(JobType.ARTICLE)).isFalse();
        assertThat(output).doesNotContain("does not exceed generation timeout");
    }

    @Test
    void warnsWhenClaimsExpireBeforeGenerationTimesOut(CapturedOutput output) {
        ForgeProperties properties = memoryProperties();
        properties.getQueue().setVisibilityTimeout(Duration.ofMinutes(10));
        properties.getGeneration().setTimeout(Duration.ofMinutes(30));

        config.jobQueueRegistry(properties, redisTemplate, TestJobs.MAPPER,
            MutableClock.startingAt("2026-03-01T10:00:00Z"));

        assertThat(output).contains("Queue visibility timeout PT10M does not exceed generation timeout PT30M");
    }

    @Test
    void noWarningWithoutQueues(CapturedOutput output) {
        ForgeProperties properties = memoryProperties();
        properties.getQueue().setBackend(ForgeProperties.QueueBackend.NONE);
        properties.getQueue().setVisibilityTimeout(Duration.ofMinutes(1));

        JobQueueRegistry registry = config.jobQueueRegistry(properties, redisTemplate, TestJobs.MAPPER,
            MutableClock.startingAt("2026-03-01T10:00:00Z"));

        assertThat(registry.isConfigured(JobType.IMAGE)).isFalse();
        assertThat(output).doesNotContain("does not exceed generation timeout");
    }

    private static ForgeProperties memoryProperties() {
        ForgeProperties properties = new ForgeProperties();
        properties.getQueue().setBackend(ForgeProperties.QueueBackend.MEMORY);
        return properties;
    }
}
