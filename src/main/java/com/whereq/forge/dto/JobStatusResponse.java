package com.whereq.forge.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.forge.model.GenerationResult;
import com.whereq.forge.model.Job;
import com.whereq.forge.model.JobError;
import com.whereq.forge.model.JobStatus;
import com.whereq.forge.model.JobType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for job status query
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobStatusResponse {
    /**
     * Job identifier
     */
    private String jobId;

    private JobType type;

    /**
     * Current status
     */
    private JobStatus status;

    /**
     * Processing attempts so far
     */
    private int attempts;

    /**
     * Generated content (if completed)
     */
    private GenerationResult result;

    /**
     * Failure details (if failed)
     */
    private JobError error;

    private Instant createdAt;

    private Instant startedAt;

    private Instant completedAt;

    public static JobStatusResponse fromJob(Job job) {
        return JobStatusResponse.builder()
            .jobId(job.getId())
            .type(job.getType())
            .status(job.getStatus())
            .attempts(job.getAttempts())
            .result(job.getResult())
            .error(job.getError())
            .createdAt(job.getCreatedAt())
            .startedAt(job.getStartedAt())
            .completedAt(job.getCompletedAt())
            .build();
    }
}
