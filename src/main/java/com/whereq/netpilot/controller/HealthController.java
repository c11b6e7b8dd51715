package com.whereq.netpilot.controller;

import com.whereq.netpilot.queue.JobQueue;
import com.whereq.netpilot.safety.CommandSafetyClassifier;
import com.whereq.netpilot.service.JobLifecycleManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Health check controller reporting queue depth and job engine state.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
@Tag(name = "Health", description = "Service health check endpoints")
public class HealthController {

    private final JobQueue jobQueue;
    private final JobLifecycleManager lifecycleManager;
    private final CommandSafetyClassifier classifier;

    @GetMapping
    @Operation(summary = "Health check", description = "Check if the service and its job queue are reachable")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return jobQueue.depth()
                .map(depth -> {
                    Map<String, Object> health = baseHealth();

                    Map<String, Object> queueInfo = new HashMap<>();
                    queueInfo.put("status", "CONNECTED");
                    queueInfo.put("depth", depth);
                    health.put("queue", queueInfo);
                    return ResponseEntity.ok(health);
                })
                .onErrorResume(e -> {
                    Map<String, Object> health = baseHealth();

                    Map<String, Object> queueInfo = new HashMap<>();
                    queueInfo.put("status", "ERROR");
                    queueInfo.put("error", e.getMessage());
                    health.put("queue", queueInfo);

                    return Mono.just(ResponseEntity.ok(health));
                });
    }

    private Map<String, Object> baseHealth() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "whereq-netpilot");
        health.put("activeJobs", lifecycleManager.getActiveJobCount());
        health.put("ruleSetVersion", classifier.getRuleSetVersion());
        return health;
    }
}
