package com.whereq.forge.queue;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.forge.model.JobType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Wire body of a queue message. Carries everything a worker needs to run the
 * generation; the job store is consulted only to record the outcome.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueMessageBody {
    /**
     * Job this message delivers
     */
    private String jobId;

    private JobType type;

    /**
     * Generation parameters, shaped by {@link #type}
     */
    private JsonNode payload;

    /**
     * ISO-8601 enqueue time
     */
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant enqueuedAt;
}
