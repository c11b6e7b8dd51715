package com.whereq.netpilot.service;

import com.whereq.netpilot.config.NetPilotProperties;
import com.whereq.netpilot.dispatch.DispatchCoordinator;
import com.whereq.netpilot.exception.IllegalJobTransitionException;
import com.whereq.netpilot.exception.InvalidTargetException;
import com.whereq.netpilot.exception.StalePreviewException;
import com.whereq.netpilot.handler.JobHandler;
import com.whereq.netpilot.model.DeviceTarget;
import com.whereq.netpilot.model.Job;
import com.whereq.netpilot.model.JobLogEntry;
import com.whereq.netpilot.model.JobStatus;
import com.whereq.netpilot.model.JobSummary;
import com.whereq.netpilot.model.QueuedJob;
import com.whereq.netpilot.queue.JobQueue;
import com.whereq.netpilot.resolver.TargetResolver;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Background job processor that consumes from queue and executes jobs
 */
@Slf4j
@Service
public class AsyncJobExecutor {

    private final JobQueue jobQueue;
    private final JobLifecycleManager lifecycleManager;
    private final ExecutionStrategyFactory executionStrategyFactory;
    private final TargetResolver targetResolver;
    private final DispatchCoordinator dispatchCoordinator;
    private final int maxConcurrentJobs;

    private final Timer executionTimer;

    private Disposable processor;

    public AsyncJobExecutor(JobQueue jobQueue, JobLifecycleManager lifecycleManager,
                            ExecutionStrategyFactory executionStrategyFactory, TargetResolver targetResolver,
                            DispatchCoordinator dispatchCoordinator, NetPilotProperties properties,
                            MeterRegistry meterRegistry) {
        this.jobQueue = jobQueue;
        this.lifecycleManager = lifecycleManager;
        this.executionStrategyFactory = executionStrategyFactory;
        this.targetResolver = targetResolver;
        this.dispatchCoordinator = dispatchCoordinator;
        this.maxConcurrentJobs = properties.getJobs().getMaxConcurrentJobs();

        executionTimer = Timer.builder("netpilot.jobs.execution.time")
            .description("Job execution time from dispatch to terminal state")
            .register(meterRegistry);
    }

    @PostConstruct
    public void startJobProcessor() {
        log.info("Starting async job processor ({} concurrent jobs)", maxConcurrentJobs);

        processor = jobQueue.consume()
            .flatMap(queued -> processJob(queued)
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> {
                    log.error("Error processing job {}: {}", queued.getJobId(), e.getMessage(), e);
                    return Mono.empty(); // Continue processing next job
                })
                .doFinally(signal -> jobQueue.acknowledge(queued.getJobId()).subscribe()),
                maxConcurrentJobs)
            .doOnError(e -> log.error("Fatal error in job processor", e))
            .retry() // Restart processor on fatal error
            .subscribe();

        log.info("Async job processor started successfully");
    }

    @PreDestroy
    public void stop() {
        if (processor != null) {
            processor.dispose();
            log.info("Async job processor stopped");
        }
    }

    /**
     * Claim, wait for the scheduled time if any, then run a single job
     */
    Mono<Job> processJob(QueuedJob queued) {
        return lifecycleManager.claim(queued.getJobId())
            .flatMap(run -> waitUntilDue(run, queued)
                .then(Mono.defer(() -> run.status() == JobStatus.QUEUED ? executeJob(run) : Mono.empty())));
    }

    private Mono<Void> waitUntilDue(JobRun run, QueuedJob queued) {
        Duration delay = queued.delayFrom(Instant.now());
        if (delay.isZero()) {
            return Mono.empty();
        }
        log.info("Job {} scheduled for {}, waiting {}s", run.getJobId(), queued.getExecuteAt(), delay.toSeconds());
        // A cancelled job stops waiting at once
        return Mono.firstWithSignal(Mono.delay(delay).then(), run.whenTerminal().then());
    }

    /**
     * Resolve, plan, dispatch and finalize a claimed job
     */
    private Mono<Job> executeJob(JobRun run) {
        Job job = run.snapshot();
        JobHandler handler = executionStrategyFactory.selectHandler(job.getType());
        long startTime = System.currentTimeMillis();

        // Inventory may have changed since submission
        return targetResolver.resolve(job.getTargets(), job.getTenantId())
            .flatMap(targets -> {
                if (targets.isEmpty()) {
                    run.append(JobLogEntry.warn(null, "Target specification matched no devices"));
                    return lifecycleManager.finish(run, JobStatus.NO_TARGETS, JobSummary.empty());
                }
                return handler.plan(job, targets)
                    .flatMap(plan -> {
                        Job running = lifecycleManager.start(run);
                        run.append(JobLogEntry.info(null, "Dispatching to " + describe(targets)));
                        return dispatchCoordinator.dispatch(running.getId(), plan,
                                lifecycleManager.timeoutFor(running), run::isCancelRequested, run)
                            .flatMap(outcome -> handler.complete(running, outcome, run)
                                .flatMap(summary -> lifecycleManager.finish(run, outcome.deriveStatus(), summary)));
                    });
            })
            .onErrorResume(InvalidTargetException.class, e -> failBeforeDispatch(run, "Target resolution failed: " + e.getMessage()))
            .onErrorResume(StalePreviewException.class, e -> failBeforeDispatch(run, "Preview verification failed: " + e.getMessage()))
            .onErrorResume(IllegalJobTransitionException.class, e -> {
                log.info("Job {} changed state before dispatch: {}", run.getJobId(), e.getMessage());
                return Mono.empty();
            })
            .onErrorResume(e -> !(e instanceof IllegalJobTransitionException) && !run.status().isTerminal(), e -> {
                log.error("Unexpected failure while executing job {}", run.getJobId(), e);
                return failRun(run, "Internal error: " + e.getMessage());
            })
            .doOnNext(finished -> executionTimer.record(Duration.ofMillis(System.currentTimeMillis() - startTime)));
    }

    private Mono<Job> failBeforeDispatch(JobRun run, String reason) {
        log.warn("Job {} failed before dispatch: {}", run.getJobId(), reason);
        return failRun(run, reason);
    }

    private Mono<Job> failRun(JobRun run, String reason) {
        return Mono.defer(() -> {
            run.append(JobLogEntry.error(null, reason));
            JobSummary summary = run.status() == JobStatus.RUNNING ? run.snapshot().getSummary() : JobSummary.empty();
            return lifecycleManager.finish(run, JobStatus.FAILED, summary);
        });
    }

    private static String describe(List<DeviceTarget> targets) {
        return targets.size() == 1 ? "1 device" : targets.size() + " devices";
    }
}
