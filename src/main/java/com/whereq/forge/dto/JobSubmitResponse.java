package com.whereq.forge.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.forge.model.Job;
import com.whereq.forge.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Response for job submission
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobSubmitResponse {
    /**
     * Unique job identifier
     */
    private String jobId;

    /**
     * Status after submission: queued, or terminal when generated synchronously
     */
    private JobStatus status;

    /**
     * When the job was submitted
     */
    private Instant submittedAt;

    /**
     * Full job, present when it was generated synchronously
     */
    private JobStatusResponse job;

    /**
     * Error message (if submission failed)
     */
    private String errorMessage;

    /**
     * Individual validation failures
     */
    private List<String> violations;

    public static JobSubmitResponse fromJob(Job job) {
        JobSubmitResponseBuilder response = JobSubmitResponse.builder()
            .jobId(job.getId())
            .status(job.getStatus())
            .submittedAt(job.getCreatedAt());
        if (job.getStatus().isTerminal()) {
            response.job(JobStatusResponse.fromJob(job));
        }
        return response.build();
    }

    /**
     * Create error response
     */
    public static JobSubmitResponse error(String message) {
        return JobSubmitResponse.builder()
            .errorMessage(message)
            .build();
    }

    public static JobSubmitResponse invalid(List<String> violations) {
        return JobSubmitResponse.builder()
            .errorMessage("Invalid job submission")
            .violations(violations)
            .build();
    }
}
