package com.whereq.forge.controller;

import com.whereq.forge.config.ForgeProperties;
import com.whereq.forge.model.JobType;
import com.whereq.forge.queue.JobQueueRegistry;
import com.whereq.forge.worker.WorkerManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health check controller reporting store, queue and worker state.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Service health check endpoints")
public class HealthController {

    @Autowired
    private ForgeProperties properties;

    @Autowired
    private JobQueueRegistry queueRegistry;

    @Autowired
    private WorkerManager workerManager;

    @Value("${spring.application.name:whereq-forge}")
    private String serviceName;

    @GetMapping
    @Operation(summary = "Health check", description = "Check the job store, queues and workers")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        Map<JobType, Boolean> workerStates = workerManager.getWorkerStates();

        return Flux.fromArray(JobType.values())
            .concatMap(type -> queueInfo(type, workerStates).map(info -> Map.entry(type.getValue(), info)))
            .collectMap(Map.Entry::getKey, Map.Entry::getValue, LinkedHashMap::new)
            .map(queues -> {
                Map<String, Object> health = new LinkedHashMap<>();
                health.put("status", "UP");
                health.put("service", serviceName);
                health.put("store", properties.getStore().getType().name().toLowerCase());
                health.put("queueBackend", properties.getQueue().getBackend().name().toLowerCase());
                health.put("workersEnabled", workerManager.isEnabled());
                health.put("queues", queues);
                return ResponseEntity.ok(health);
            });
    }

    private Mono<Map<String, Object>> queueInfo(JobType type, Map<JobType, Boolean> workerStates) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("configured", queueRegistry.isConfigured(type));
        info.put("workerRunning", workerStates.getOrDefault(type, false));

        return queueRegistry.find(type)
            .map(queue -> queue.approximateDepth()
                .map(depth -> {
                    info.put("status", "CONNECTED");
                    info.put("depth", depth);
                    return info;
                })
                .onErrorResume(e -> {
                    info.put("status", "ERROR");
                    info.put("error", e.getMessage());
                    return Mono.just(info);
                }))
            .orElseGet(() -> {
                info.put("status", "SYNCHRONOUS");
                return Mono.just(info);
            });
    }
}
