package com.whereq.forge.queue;

import com.whereq.forge.exception.QueueUnavailableException;
import com.whereq.forge.model.JobType;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Queues configured at startup, one per enabled job type
 */
public class JobQueueRegistry {

    private final Map<JobType, JobQueue> queues = new EnumMap<>(JobType.class);

    public JobQueueRegistry(Collection<? extends JobQueue> queues) {
        for (JobQueue queue : queues) {
            if (this.queues.putIfAbsent(queue.getType(), queue) != null) {
                throw new IllegalArgumentException("Duplicate queue for " + queue.getType().getValue() + " jobs");
            }
        }
    }

    public static JobQueueRegistry empty() {
        return new JobQueueRegistry(Collections.emptyList());
    }

    public Optional<JobQueue> find(JobType type) {
        return Optional.ofNullable(queues.get(type));
    }

    /**
     * Queue for {@code type}
     *
     * @throws QueueUnavailableException if the type has no queue
     */
    public JobQueue require(JobType type) {
        JobQueue queue = queues.get(type);
        if (queue == null) {
            throw new QueueUnavailableException(type);
        }
        return queue;
    }

    public boolean isConfigured(JobType type) {
        return queues.containsKey(type);
    }

    public Collection<JobQueue> all() {
        return Collections.unmodifiableCollection(queues.values());
    }
}
