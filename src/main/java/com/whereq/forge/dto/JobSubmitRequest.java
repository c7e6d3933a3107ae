package com.whereq.forge.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.forge.model.JobType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to submit a generation job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobSubmitRequest {
    /**
     * Submitting user, counted against the active-job quota
     */
    @NotBlank(message = "userId is required")
    private String userId;

    @NotNull(message = "type is required")
    private JobType type;

    /**
     * Generation parameters; shape depends on {@link #type}
     */
    @NotNull(message = "payload is required")
    private JsonNode payload;
}
