package com.whereq.netpilot.store;

import com.whereq.netpilot.model.DeviceResult;
import com.whereq.netpilot.model.Job;
import com.whereq.netpilot.model.JobLogEntry;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Durable persistence for jobs, their audit logs and device results.
 * The lifecycle manager is the only writer and enforces the state machine before calling in.
 */
public interface JobStore {
    /**
     * Persist a new job record
     */
    Mono<Void> create(Job job);

    /**
     * Persist a state transition. The record carries the new status, timestamps and summary.
     */
    Mono<Void> setStatus(Job job);

    Mono<Void> appendLog(String jobId, JobLogEntry entry);

    Mono<Void> appendResult(String jobId, DeviceResult result);

    /**
     * @return the job, or empty if unknown or expired
     */
    Mono<Job> get(String jobId);

    /**
     * Log entries in append order
     */
    Flux<JobLogEntry> logs(String jobId);

    /**
     * Device results in append order
     */
    Flux<DeviceResult> results(String jobId);
}
