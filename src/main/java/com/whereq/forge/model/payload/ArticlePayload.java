package com.whereq.forge.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.forge.model.JobType;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.net.URI;
import java.util.List;

/**
 * Parameters for article generation
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ArticlePayload extends GenerationPayload {

    @NotNull(message = "mode is required")
    private ArticleMode mode;

    private String topic;

    private List<String> keywords;

    private String keywordDensity;

    private String trendTopic;

    private String trendUrl;

    private String trendDescription;

    private String trendSource;

    private List<String> trendRelatedQueries;

    private String region;

    private String sourceUrl;

    private String originalContent;

    private String spinAngle;

    private String spinIntensity;

    private String contentStructure;

    @Min(value = 100, message = "wordCount must be at least 100")
    @Max(value = 10000, message = "wordCount must be at most 10000")
    @Builder.Default
    private int wordCount = 1000;

    @NotBlank(message = "tone must not be blank")
    @Builder.Default
    private String tone = "professional";

    @Builder.Default
    private boolean seoOptimization = true;

    @Override
    public JobType getType() {
        return JobType.ARTICLE;
    }

    /**
     * Each mode needs its own source field
     */
    @JsonIgnore
    @AssertTrue(message = "payload is missing the field required by its mode "
        + "(topic: topic, keywords: keywords, trends: trendTopic, spin: originalContent)")
    public boolean isModeSourcePresent() {
        if (mode == null) {
            return true;
        }
        return switch (mode) {
            case TOPIC -> hasText(topic);
            case KEYWORDS -> keywords != null && keywords.stream().anyMatch(ArticlePayload::hasText);
            case TRENDS -> hasText(trendTopic);
            case SPIN -> hasText(originalContent);
        };
    }

    /**
     * Title for the generated article
     */
    @JsonIgnore
    public String getDisplayTitle() {
        if (mode == ArticleMode.SPIN) {
            String domain = sourceDomain();
            if (domain != null) {
                return "Article Spin: " + domain;
            }
            return spinAngle != null ? "Article Spin: " + spinAngle : "Spun Article";
        }
        if (hasText(topic)) {
            return topic;
        }
        if (hasText(trendTopic)) {
            return trendTopic;
        }
        return "Generated from " + (mode != null ? mode.getValue() : "article");
    }

    private String sourceDomain() {
        if (!hasText(sourceUrl)) {
            return null;
        }
        try {
            String host = URI.create(sourceUrl).getHost();
            return host != null ? host.replaceFirst("^www\\.", "") : null;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
