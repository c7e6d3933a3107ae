package com.whereq.forge.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * One page of a user's jobs, newest first, with per-status counts over all of them
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobListResponse {

    private String userId;

    private List<JobStatusResponse> jobs;

    /**
     * Jobs matching the status filter, before paging
     */
    private long total;

    private int limit;

    private int offset;

    /**
     * Count per status value, every status present
     */
    private Map<String, Long> stats;
}
