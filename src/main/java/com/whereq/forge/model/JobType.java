package com.whereq.forge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.whereq.forge.model.payload.ArticlePayload;
import com.whereq.forge.model.payload.GenerationPayload;
import com.whereq.forge.model.payload.ImagePayload;
import com.whereq.forge.model.payload.VideoPayload;

/**
 * Kind of generation job. Selects the queue a job travels on and the shape of its payload.
 */
public enum JobType {
    ARTICLE("article", ArticlePayload.class),
    IMAGE("image", ImagePayload.class),
    VIDEO("video", VideoPayload.class);

    private final String value;
    private final Class<? extends GenerationPayload> payloadClass;

    JobType(String value, Class<? extends GenerationPayload> payloadClass) {
        this.value = value;
        this.payloadClass = payloadClass;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Class<? extends GenerationPayload> getPayloadClass() {
        return payloadClass;
    }

    @JsonCreator
    public static JobType fromValue(String value) {
        for (JobType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown job type: " + value);
    }
}
