package com.whereq.netpilot.broadcast;

import com.whereq.netpilot.model.JobEvent;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Process-local broadcast. Events published with no subscriber are dropped.
 */
@Service
@ConditionalOnProperty(name = "netpilot.store.type", havingValue = "memory")
public class InMemoryBroadcastChannel implements BroadcastChannel {

    private final Sinks.Many<JobEvent> sink = Sinks.many().multicast().directBestEffort();

    @Override
    public Mono<Void> publish(String jobId, JobEvent event) {
        return Mono.fromRunnable(() -> {
            synchronized (sink) {
                sink.tryEmitNext(event);
            }
        });
    }

    @Override
    public Flux<JobEvent> subscribe(String jobId) {
        return sink.asFlux().filter(event -> jobId.equals(event.getJobId()));
    }
}
