package com.whereq.forge.model.payload;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Article generation strategy, mapped to the backend endpoint of the same name
 */
public enum ArticleMode {
    /**
     * Write about a free-form topic
     */
    TOPIC("topic"),

    /**
     * Write around a list of keywords
     */
    KEYWORDS("keywords"),

    /**
     * Write about a trending topic
     */
    TRENDS("trends"),

    /**
     * Rewrite existing content from a new angle
     */
    SPIN("spin");

    private final String value;

    ArticleMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ArticleMode fromValue(String value) {
        for (ArticleMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown article mode: " + value);
    }
}
