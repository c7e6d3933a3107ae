package com.whereq.forge.service;

import com.whereq.forge.exception.JobNotFoundException;
import com.whereq.forge.exception.JobValidationException;
import com.whereq.forge.model.Job;
import com.whereq.forge.model.JobStatus;
import com.whereq.forge.model.JobUpdate;
import com.whereq.forge.store.InMemoryJobStore;
import com.whereq.forge.support.TestComponents;
import com.whereq.forge.support.TestJobs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class JobQueryServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private InMemoryJobStore jobStore;
    private JobQueryService service;

    @BeforeEach
    void setUp() {
        jobStore = new InMemoryJobStore();
        service = TestComponents.queryService(jobStore);
    }

    @Test
    void getReturnsStatusDocument() {
        Job job = TestJobs.queuedImageJob("user-1", NOW);
        jobStore.create(job).block();

        StepVerifier.create(service.getJob(job.getId()))
            .assertNext(response -> {
                assertThat(response.getJobId()).isEqualTo(job.getId());
                assertThat(response.getStatus()).isEqualTo(JobStatus.QUEUED);
                assertThat(response.getCreatedAt()).isEqualTo(NOW);
                assertThat(response.getResult()).isNull();
                assertThat(response.getError()).isNull();
            })
            .verifyComplete();

        StepVerifier.create(service.getJob("missing"))
            .expectError(JobNotFoundException.class)
            .verify();
    }

    @Test
    void listFiltersPagesAndCountsByStatus() {
        for (int i = 0; i < 4; i++) {
            jobStore.create(TestJobs.queuedImageJob("user-1", NOW.plusSeconds(i))).block();
        }
        Job cancelled = TestJobs.queuedImageJob("user-1", NOW.plusSeconds(10));
        jobStore.create(cancelled).block();
        jobStore.compareAndSetStatus(cancelled.getId(), JobStatus.ACTIVE, JobStatus.CANCELLED, JobUpdate.cancel(NOW)).block();

        StepVerifier.create(service.listJobs("user-1", JobStatus.QUEUED, 2, 1))
            .assertNext(page -> {
                assertThat(page.getTotal()).isEqualTo(4);
                assertThat(page.getJobs()).hasSize(2);
                assertThat(page.getJobs().get(0).getCreatedAt()).isEqualTo(NOW.plusSeconds(2));
                assertThat(page.getStats())
                    .containsEntry("queued", 4L)
                    .containsEntry("cancelled", 1L)
                    .containsEntry("completed", 0L);
            })
            .verifyComplete();
    }

    @Test
    void listRejectsBadPaging() {
        StepVerifier.create(service.listJobs("user-1", null, 0, 0))
            .expectError(JobValidationException.class)
            .verify();
        StepVerifier.create(service.listJobs("user-1", null, 10, -1))
            .expectError(JobValidationException.class)
            .verify();
    }
}
