package com.whereq.forge.generation;

import com.whereq.forge.model.GenerationResult;
import com.whereq.forge.model.JobType;
import com.whereq.forge.model.payload.GenerationPayload;
import reactor.core.publisher.Mono;

/**
 * Interface for content generation backends
 */
public interface GenerationClient {

    /**
     * Generate content for one job
     *
     * @param type job type
     * @param payload validated payload of that type
     * @return Mono with the result; errors with a
     *         {@link com.whereq.forge.exception.GenerationException} when the backend call fails
     */
    Mono<GenerationResult> generate(JobType type, GenerationPayload payload);
}
