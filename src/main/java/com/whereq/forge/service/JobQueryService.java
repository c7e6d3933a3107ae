package com.whereq.forge.service;

import com.whereq.forge.dto.JobListResponse;
import com.whereq.forge.dto.JobStatusResponse;
import com.whereq.forge.exception.JobNotFoundException;
import com.whereq.forge.exception.JobValidationException;
import com.whereq.forge.model.Job;
import com.whereq.forge.model.JobStatus;
import com.whereq.forge.store.JobStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read side of the job store
 */
@Service
public class JobQueryService {

    public static final int MAX_PAGE_SIZE = 100;

    @Autowired
    private JobStore jobStore;

    public Mono<JobStatusResponse> getJob(String jobId) {
        return jobStore.get(jobId)
            .switchIfEmpty(Mono.error(() -> new JobNotFoundException(jobId)))
            .map(JobStatusResponse::fromJob);
    }

    /**
     * List a user's jobs, newest first
     *
     * @param userId user identifier
     * @param status only jobs in this status, or null for all
     * @param limit page size, 1 to {@value #MAX_PAGE_SIZE}
     * @param offset jobs to skip
     * @return Mono with the page and per-status counts over all of the user's jobs
     */
    public Mono<JobListResponse> listJobs(String userId, JobStatus status, int limit, int offset) {
        if (userId == null || userId.isBlank()) {
            return Mono.error(new JobValidationException("userId is required"));
        }
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            return Mono.error(new JobValidationException("limit must be between 1 and " + MAX_PAGE_SIZE));
        }
        if (offset < 0) {
            return Mono.error(new JobValidationException("offset must not be negative"));
        }

        return jobStore.listForUser(userId)
            .collectList()
            .map(jobs -> {
                List<Job> matching = status == null
                    ? jobs
                    : jobs.stream().filter(job -> job.getStatus() == status).toList();

                List<JobStatusResponse> page = matching.stream()
                    .skip(offset)
                    .limit(limit)
                    .map(JobStatusResponse::fromJob)
                    .toList();

                return JobListResponse.builder()
                    .userId(userId)
                    .jobs(page)
                    .total(matching.size())
                    .limit(limit)
                    .offset(offset)
                    .stats(countByStatus(jobs))
                    .build();
            });
    }

    private static Map<String, Long> countByStatus(List<Job> jobs) {
        Map<String, Long> stats = new LinkedHashMap<>();
        for (JobStatus status : JobStatus.values()) {
            stats.put(status.getValue(), 0L);
        }
        for (Job job : jobs) {
            stats.merge(job.getStatus().getValue(), 1L, Long::sum);
        }
        return stats;
    }
}
