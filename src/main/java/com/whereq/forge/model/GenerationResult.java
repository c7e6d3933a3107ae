package com.whereq.forge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Output of a successful generation call.
 * Images and videos carry a {@code url}; articles carry {@code content} and {@code title}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GenerationResult {

    private String url;

    private String title;

    private String content;

    /**
     * Backend-reported details (generation time, dimensions, ...)
     */
    private Map<String, Object> metadata;
}
