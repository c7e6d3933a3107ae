package com.whereq.forge.dto;

import com.whereq.forge.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for job cancellation
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobCancellationResponse {
    /**
     * Job identifier
     */
    private String jobId;

    /**
     * Status after the request; a job that had already finished keeps its terminal status
     */
    private JobStatus status;

    /**
     * When the job was cancelled or finished
     */
    private Instant cancelledAt;

    /**
     * Cancellation message
     */
    private String message;
}
