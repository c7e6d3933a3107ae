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
 * Parameters for video generation. Unset dimensions fall back to the model's defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VideoPayload extends GenerationPayload {

    @NotBlank(message = "prompt is required")
    @Size(max = 1000, message = "prompt must be at most 1000 characters")
    private String prompt;

    @Min(value = 256, message = "width must be at least 256")
    @Max(value = 2048, message = "width must be at most 2048")
    private Integer width;

    @Min(value = 256, message = "height must be at least 256")
    @Max(value = 2048, message = "height must be at most 2048")
    private Integer height;

    @Size(max = 500, message = "negativePrompt must be at most 500 characters")
    private String negativePrompt;

    @Min(value = 1, message = "numFrames must be at least 1")
    @Max(value = 200, message = "numFrames must be at most 200")
    private Integer numFrames;

    private Long seed;

    /**
     * Source image URL for image-to-video models
     */
    private String image;

    @Override
    public JobType getType() {
        return JobType.VIDEO;
    }
}
