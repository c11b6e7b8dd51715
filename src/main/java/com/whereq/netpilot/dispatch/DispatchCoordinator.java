package com.whereq.netpilot.dispatch;

import com.whereq.netpilot.executor.DeviceExecutor;
import com.whereq.netpilot.model.DeviceErrorKind;
import com.whereq.netpilot.model.DeviceResult;
import com.whereq.netpilot.model.DeviceTarget;
import com.whereq.netpilot.model.JobProgress;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Fans a dispatch plan out over a bounded pool of device workers and aggregates the results.
 * <p>
 * Each device gets exactly one result. A worker that observes cancellation before starting
 * records its device as skipped; workers already talking to a device run to completion.
 *
 * @author WhereQ Inc.
 */
@Slf4j
public class DispatchCoordinator {

    static final String CANCELLED_REASON = "Job cancelled before dispatch";
    static final String MISSING_RESULT_REASON = "Device produced no result";

    private final DeviceExecutor deviceExecutor;
    private final int maxConcurrency;

    public DispatchCoordinator(DeviceExecutor deviceExecutor, int maxConcurrency) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1");
        }
        this.deviceExecutor = deviceExecutor;
        this.maxConcurrency = maxConcurrency;
    }

    /**
     * Run every item of the plan and complete once all results are collected
     *
     * @param jobId job being dispatched, for logging
     * @param plan per-device work
     * @param timeout per-device timeout
     * @param cancelled polled before each device starts
     * @param listener receives every result with its progress snapshot
     * @return Mono with the aggregated outcome
     */
    public Mono<DispatchOutcome> dispatch(String jobId, DispatchPlan plan, Duration timeout,
                                          BooleanSupplier cancelled, DispatchListener listener) {
        ResultAccumulator accumulator = new ResultAccumulator(plan.size());

        log.info("Dispatching job {} to {} devices (concurrency {}, timeout {}s)",
            jobId, plan.size(), maxConcurrency, timeout.toSeconds());

        return Flux.fromIterable(plan.getItems())
            .flatMap(item -> runItem(item, timeout, cancelled, listener), maxConcurrency)
            .doOnNext(result -> {
                JobProgress progress = accumulator.add(result);
                notifyListener(jobId, listener, result, progress);
            })
            .then(Mono.fromRunnable(() -> recordMissing(jobId, plan, accumulator, listener)))
            .then(Mono.fromCallable(() -> new DispatchOutcome(
                accumulator.results(),
                accumulator.summary(),
                cancelled.getAsBoolean())))
            .doOnNext(outcome -> log.info("Job {} dispatch finished: {}", jobId, outcome.getSummary()));
    }

    private Mono<DeviceResult> runItem(DispatchItem item, Duration timeout,
                                       BooleanSupplier cancelled, DispatchListener listener) {
        return Mono.defer(() -> {
            if (item.isSkipped()) {
                return Mono.just(DeviceResult.skipped(item.getTarget(), item.getSkipReason()));
            }
            if (cancelled.getAsBoolean()) {
                return Mono.just(DeviceResult.skipped(item.getTarget(), CANCELLED_REASON));
            }
            notifyStart(listener, item.getTarget());
            return deviceExecutor.execute(item.getTarget(), item.getUnit(), timeout)
                .switchIfEmpty(Mono.fromSupplier(() -> DeviceResult.failed(item.getTarget(),
                    DeviceErrorKind.PROTOCOL_ERROR, MISSING_RESULT_REASON)));
        });
    }

    /**
     * Every planned device ends with exactly one result
     */
    private void recordMissing(String jobId, DispatchPlan plan, ResultAccumulator accumulator,
                               DispatchListener listener) {
        for (DispatchItem item : plan.getItems()) {
            if (accumulator.contains(item.getTarget().getDeviceId())) {
                continue;
            }
            log.error("Job {} device {} produced no result", jobId, item.getTarget().getDeviceId());
            DeviceResult result = DeviceResult.failed(item.getTarget(), DeviceErrorKind.PROTOCOL_ERROR,
                MISSING_RESULT_REASON);
            notifyListener(jobId, listener, result, accumulator.add(result));
        }
    }

    private void notifyStart(DispatchListener listener, DeviceTarget target) {
        try {
            listener.onStart(target);
        } catch (RuntimeException e) {
            log.warn("Start listener failed for device {}: {}", target.getDeviceId(), e.getMessage());
        }
    }

    private void notifyListener(String jobId, DispatchListener listener, DeviceResult result, JobProgress progress) {
        try {
            listener.onResult(result, progress);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed for job {} device {}: {}", jobId, result.getDeviceId(), e.getMessage());
        }
    }
}
