package com.whereq.forge.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.whereq.forge.model.Job;
import com.whereq.forge.model.JobStatus;
import com.whereq.forge.model.JobType;
import com.whereq.forge.model.payload.ArticleMode;
import com.whereq.forge.model.payload.ArticlePayload;
import com.whereq.forge.model.payload.ImagePayload;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.time.Instant;
import java.util.UUID;

/**
 * Fixtures shared by the tests
 */
public final class TestJobs {

    public static final ObjectMapper MAPPER = Jackson2ObjectMapperBuilder.json().build();

    private TestJobs() {
    }

    public static ImagePayload imagePayload(String prompt) {
        return ImagePayload.builder()
            .prompt(prompt)
            .build();
    }

    public static ArticlePayload topicArticle(String topic) {
        return ArticlePayload.builder()
            .mode(ArticleMode.TOPIC)
            .topic(topic)
            .build();
    }

    public static ObjectNode imagePayloadJson(String prompt) {
        ObjectNode payload = MAPPER.createObjectNode();
        payload.put("prompt", prompt);
        return payload;
    }

    public static Job queuedImageJob(String userId, Instant createdAt) {
        return Job.builder()
            .id(UUID.randomUUID().toString())
            .type(JobType.IMAGE)
            .userId(userId)
            .status(JobStatus.QUEUED)
            .payload(imagePayload("a lighthouse at dusk"))
            .createdAt(createdAt)
            .build();
    }
}
