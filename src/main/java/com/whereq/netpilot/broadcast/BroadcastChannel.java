package com.whereq.netpilot.broadcast;

import com.whereq.netpilot.model.JobEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Best-effort live notification of job state, progress and log changes.
 * Publishing never affects the job: callers log and drop failures.
 */
public interface BroadcastChannel {
    /**
     * Publish an event for a job
     *
     * @return Mono that completes when the event was handed to the channel
     */
    Mono<Void> publish(String jobId, JobEvent event);

    /**
     * Live events of one job, starting from the moment of subscription
     */
    Flux<JobEvent> subscribe(String jobId);
}
