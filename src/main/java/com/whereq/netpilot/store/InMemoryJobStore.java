package com.whereq.netpilot.store;

import com.whereq.netpilot.model.DeviceResult;
import com.whereq.netpilot.model.Job;
import com.whereq.netpilot.model.JobLogEntry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-local job store. Records live until the process exits.
 */
@Service
@ConditionalOnProperty(name = "netpilot.store.type", havingValue = "memory")
public class InMemoryJobStore implements JobStore {

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final Map<String, List<JobLogEntry>> logs = new ConcurrentHashMap<>();
    private final Map<String, List<DeviceResult>> results = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> create(Job job) {
        return Mono.fromRunnable(() -> jobs.put(job.getId(), job.toBuilder().build()));
    }

    @Override
    public Mono<Void> setStatus(Job job) {
        return Mono.fromRunnable(() -> jobs.put(job.getId(), job.toBuilder().build()));
    }

    @Override
    public Mono<Void> appendLog(String jobId, JobLogEntry entry) {
        return Mono.fromRunnable(() -> logs.computeIfAbsent(jobId, id -> new CopyOnWriteArrayList<>()).add(entry));
    }

    @Override
    public Mono<Void> appendResult(String jobId, DeviceResult result) {
        return Mono.fromRunnable(() -> results.computeIfAbsent(jobId, id -> new CopyOnWriteArrayList<>()).add(result));
    }

    @Override
    public Mono<Job> get(String jobId) {
        return Mono.justOrEmpty(jobs.get(jobId)).map(job -> job.toBuilder().build());
    }

    @Override
    public Flux<JobLogEntry> logs(String jobId) {
        return Flux.fromIterable(logs.getOrDefault(jobId, List.of()));
    }

    @Override
    public Flux<DeviceResult> results(String jobId) {
        return Flux.fromIterable(results.getOrDefault(jobId, List.of()));
    }
}
