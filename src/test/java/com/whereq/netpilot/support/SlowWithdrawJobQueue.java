package com.whereq.netpilot.support;

import com.whereq.netpilot.queue.InMemoryJobQueue;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * In-memory queue whose withdraw answers late, as a remote queue under load would
 */
public class SlowWithdrawJobQueue extends InMemoryJobQueue {

    private volatile Duration withdrawDelay = Duration.ZERO;

    public SlowWithdrawJobQueue withdrawDelay(Duration delay) {
        this.withdrawDelay = delay;
        return this;
    }

    @Override
    public Mono<Boolean> withdraw(String jobId) {
        if (withdrawDelay.isZero()) {
            return super.withdraw(jobId);
        }
        return Mono.delay(withdrawDelay).then(super.withdraw(jobId));
    }
}
