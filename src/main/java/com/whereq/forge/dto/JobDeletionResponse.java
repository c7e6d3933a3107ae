package com.whereq.forge.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response for single job deletion and for bulk cleanup
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobDeletionResponse {
    /**
     * Deleted job, set for single deletion
     */
    private String jobId;

    /**
     * Owner whose jobs were cleaned up, set for bulk cleanup
     */
    private String userId;

    /**
     * Number of jobs removed
     */
    private long deleted;

    private String message;

    public static JobDeletionResponse error(String message) {
        return JobDeletionResponse.builder()
            .message(message)
            .build();
    }
}
