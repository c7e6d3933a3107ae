package com.whereq.forge.generation;

import com.whereq.forge.exception.GenerationException;
import com.whereq.forge.model.JobType;
import com.whereq.forge.model.payload.GenerationPayload;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.EnumMap;
import java.util.Map;

/**
 * Runs a generation call and classifies how it ended.
 * Shared by the queue workers and the synchronous fallback so both apply the same rules:
 * a {@link GenerationException} carries its own retryability, anything else is transient.
 */
@Slf4j
@Service
public class GenerationExecutor {

    @Autowired
    private GenerationClient generationClient;

    @Autowired
    private MeterRegistry meterRegistry;

    private final Map<GenerationOutcome.Kind, Counter> outcomeCounters = new EnumMap<>(GenerationOutcome.Kind.class);
    private Timer generationTimer;

    @PostConstruct
    public void initialize() {
        for (GenerationOutcome.Kind kind : GenerationOutcome.Kind.values()) {
            outcomeCounters.put(kind, Counter.builder("forge.generation.outcomes")
                .description("Generation calls by outcome")
                .tag("outcome", kind.name().toLowerCase())
                .register(meterRegistry));
        }

        generationTimer = Timer.builder("forge.generation.time")
            .description("Generation call duration")
            .register(meterRegistry);
    }

    /**
     * Generate content and classify the outcome. The returned Mono does not error.
     */
    public Mono<GenerationOutcome> execute(String jobId, JobType type, GenerationPayload payload) {
        return Mono.defer(() -> {
                Timer.Sample sample = Timer.start(meterRegistry);
                return generationClient.generate(type, payload)
                    .doFinally(signal -> sample.stop(generationTimer));
            })
            .map(GenerationOutcome::success)
            .switchIfEmpty(Mono.fromSupplier(() -> GenerationOutcome.permanentFailure(
                new IllegalStateException("Generation produced no result"))))
            .onErrorResume(e -> Mono.just(classify(e)))
            .doOnNext(outcome -> {
                outcomeCounters.get(outcome.getKind()).increment();
                if (outcome.isSuccess()) {
                    log.info("Generation succeeded for job {}", jobId);
                } else {
                    log.warn("Generation failed for job {} ({}): {}",
                        jobId, outcome.getKind(), outcome.getErrorMessage());
                }
            });
    }

    static GenerationOutcome classify(Throwable error) {
        if (error instanceof GenerationException generationError && !generationError.isRetryable()) {
            return GenerationOutcome.permanentFailure(error);
        }
        return GenerationOutcome.transientFailure(error);
    }
}
