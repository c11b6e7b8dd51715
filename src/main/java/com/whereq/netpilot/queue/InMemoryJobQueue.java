package com.whereq.netpilot.queue;

import com.whereq.netpilot.model.QueuedJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local queue backed by a unicast sink. Jobs are delivered as soon as they are enqueued.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "netpilot.store.type", havingValue = "memory")
public class InMemoryJobQueue implements JobQueue {

    private final Sinks.Many<QueuedJob> sink = Sinks.many().unicast().onBackpressureBuffer();

    // Enqueued but not yet consumed
    private final Set<String> waiting = ConcurrentHashMap.newKeySet();

    // Withdrawn while waiting; dropped on delivery
    private final Set<String> removed = ConcurrentHashMap.newKeySet();

    @Override
    public Mono<Void> enqueue(QueuedJob job) {
        return Mono.fromRunnable(() -> {
            waiting.add(job.getJobId());
            synchronized (sink) {
                sink.emitNext(job, Sinks.EmitFailureHandler.FAIL_FAST);
            }
            log.info("Enqueued {} job {}, {} waiting", job.getType(), job.getJobId(), waiting.size());
        });
    }

    @Override
    public Flux<QueuedJob> consume() {
        return sink.asFlux()
            .filter(job -> !removed.remove(job.getJobId()))
            .doOnNext(job -> waiting.remove(job.getJobId()));
    }

    @Override
    public Mono<Void> acknowledge(String jobId) {
        return Mono.empty();
    }

    @Override
    public Mono<Boolean> withdraw(String jobId) {
        return Mono.fromSupplier(() -> {
            if (waiting.remove(jobId)) {
                removed.add(jobId);
                return true;
            }
            return false;
        });
    }

    @Override
    public Mono<Long> depth() {
        return Mono.fromSupplier(() -> (long) waiting.size());
    }
}
