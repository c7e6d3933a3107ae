package com.whereq.forge.model.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.forge.model.JobType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * Parameters for image generation
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ImagePayload extends GenerationPayload {

    @NotBlank(message = "prompt is required")
    @Size(max = 1000, message = "prompt must be at most 1000 characters")
    private String prompt;

    @Min(value = 256, message = "width must be at least 256")
    @Max(value = 2048, message = "width must be at most 2048")
    @Builder.Default
    private int width = 1024;

    @Min(value = 256, message = "height must be at least 256")
    @Max(value = 2048, message = "height must be at most 2048")
    @Builder.Default
    private int height = 1024;

    @Builder.Default
    private String style = "realistic";

    @Size(max = 500, message = "negativePrompt must be at most 500 characters")
    private String negativePrompt;

    @Override
    public JobType getType() {
        return JobType.IMAGE;
    }
}
