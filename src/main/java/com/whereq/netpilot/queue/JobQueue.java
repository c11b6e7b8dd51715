package com.whereq.netpilot.queue;

import com.whereq.netpilot.model.QueuedJob;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Hand-off between job submission and the background processor.
 * Entries are delivered to one consumer, in submission order.
 */
public interface JobQueue {

    Mono<Void> enqueue(QueuedJob job);

    /**
     * Endless stream of entries for the single processor of this node
     */
    Flux<QueuedJob> consume();

    /**
     * Forget a consumed entry once its job is terminal
     */
    Mono<Void> acknowledge(String jobId);

    /**
     * Take back an entry nobody has consumed yet, used when a queued job is cancelled.
     *
     * @return true if the entry was still waiting
     */
    Mono<Boolean> withdraw(String jobId);

    /**
     * Number of entries waiting to be consumed
     */
    Mono<Long> depth();

    default Mono<Boolean> isFull(long maxDepth) {
        return depth().map(depth -> depth >= maxDepth);
    }
}
