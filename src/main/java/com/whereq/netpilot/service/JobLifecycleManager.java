package com.whereq.netpilot.service;

import com.whereq.netpilot.broadcast.BroadcastChannel;
import com.whereq.netpilot.config.NetPilotProperties;
import com.whereq.netpilot.exception.IllegalJobTransitionException;
import com.whereq.netpilot.exception.JobNotFoundException;
import com.whereq.netpilot.exception.PersistenceFailureException;
import com.whereq.netpilot.handler.JobHandler;
import com.whereq.netpilot.model.DeviceResult;
import com.whereq.netpilot.model.Job;
import com.whereq.netpilot.model.JobDetails;
import com.whereq.netpilot.model.JobLogEntry;
import com.whereq.netpilot.model.JobStatus;
import com.whereq.netpilot.model.JobSubmission;
import com.whereq.netpilot.model.JobSummary;
import com.whereq.netpilot.model.QueuedJob;
import com.whereq.netpilot.model.TenantContext;
import com.whereq.netpilot.queue.JobQueue;
import com.whereq.netpilot.resolver.TargetResolver;
import com.whereq.netpilot.store.JobStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the job state machine: submission, lookup, cancellation and the transitions made while
 * the background processor runs a job.
 * <p>
 * Jobs owned by this process are tracked as {@link JobRun}s, which are authoritative while they
 * exist. A run is dropped once its terminal state is persisted; a run whose final write failed
 * stays in memory so the job remains visible.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
public class JobLifecycleManager {

    private final JobStore jobStore;
    private final JobQueue jobQueue;
    private final BroadcastChannel broadcast;
    private final TargetResolver targetResolver;
    private final ExecutionStrategyFactory executionStrategyFactory;
    private final AdmissionController admissionController;
    private final WebhookNotifier webhookNotifier;
    private final NetPilotProperties properties;
    private final MeterRegistry meterRegistry;
    private final RetryBackoffSpec retry;

    private final Map<String, JobRun> runs = new ConcurrentHashMap<>();

    private final Counter persistenceFailureCounter;

    public JobLifecycleManager(JobStore jobStore, JobQueue jobQueue, BroadcastChannel broadcast,
                               TargetResolver targetResolver, ExecutionStrategyFactory executionStrategyFactory,
                               AdmissionController admissionController, WebhookNotifier webhookNotifier,
                               NetPilotProperties properties, MeterRegistry meterRegistry) {
        this.jobStore = jobStore;
        this.jobQueue = jobQueue;
        this.broadcast = broadcast;
        this.targetResolver = targetResolver;
        this.executionStrategyFactory = executionStrategyFactory;
        this.admissionController = admissionController;
        this.webhookNotifier = webhookNotifier;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.retry = properties.getStore().getRetry().toRetrySpec();

        persistenceFailureCounter = Counter.builder("netpilot.jobs.persistence.failures")
            .description("Jobs whose final state could not be persisted")
            .register(meterRegistry);

        Gauge.builder("netpilot.jobs.active", this, JobLifecycleManager::getActiveJobCount)
            .description("Queued and running jobs owned by this instance")
            .register(meterRegistry);
    }

    /**
     * Validate, admit and enqueue a job
     *
     * @param submission requested job
     * @param tenant caller identity
     * @return Mono with the new job id; errors with the rejection reason, in which case no job exists
     */
    public Mono<String> submit(JobSubmission submission, TenantContext tenant) {
        return Mono.defer(() -> {
            JobHandler handler = executionStrategyFactory.selectHandler(submission.getType());

            // 1. Normalize and type-specific checks (commit verifies its preview here)
            return handler.prepare(submission, tenant)
                .flatMap(prepared -> validateTimeout(prepared)
                    // 2. Confirmation gate and queue quota
                    .then(admissionController.admit(prepared))
                    .thenReturn(prepared))

                // 3. Resolve targets to validate them; nothing is dispatched yet
                .flatMap(prepared -> {
                    Job job = newJob(prepared, tenant);
                    return targetResolver.resolve(job.getTargets(), tenant.getTenantId())
                        .flatMap(targets -> targets.isEmpty()
                            ? Mono.just(job)
                            : handler.plan(job, targets).thenReturn(job));
                })

                // 4. Persist and enqueue
                .flatMap(this::createAndEnqueue);
        })
        .doOnSuccess(jobId -> {
            Counter.builder("netpilot.jobs.submitted")
                .description("Number of accepted job submissions")
                .tag("type", submission.getType().getWireName())
                .register(meterRegistry)
                .increment();
            log.info("Job {} ({}) submitted by {} for tenant {}", jobId,
                submission.getType().getWireName(), tenant.getUserId(), tenant.getTenantId());
        })
        .doOnError(e -> log.warn("Job submission rejected for tenant {}: {}", tenant.getTenantId(), e.getMessage()));
    }

    /**
     * Get a job with its device results
     */
    public Mono<JobDetails> getJob(String jobId, TenantContext tenant) {
        JobRun run = runs.get(jobId);
        Mono<JobDetails> details = run != null
            ? Mono.fromCallable(run::details)
            : jobStore.get(jobId)
                .flatMap(job -> jobStore.results(jobId)
                    .collectSortedList(Comparator.comparingLong(DeviceResult::getDeviceId))
                    .map(results -> new JobDetails(job, results)));

        return details
            .filter(found -> tenant.getTenantId().equals(found.getJob().getTenantId()))
            .switchIfEmpty(Mono.error(() -> new JobNotFoundException(jobId)));
    }

    /**
     * Audit log of a job in append order
     */
    public Flux<JobLogEntry> getLogs(String jobId, TenantContext tenant) {
        JobRun run = runs.get(jobId);
        if (run != null) {
            return checkTenant(run.snapshot(), jobId, tenant)
                .flatMapMany(job -> Flux.fromIterable(run.logs()));
        }
        return jobStore.get(jobId)
            .switchIfEmpty(Mono.error(() -> new JobNotFoundException(jobId)))
            .flatMap(job -> checkTenant(job, jobId, tenant))
            .flatMapMany(job -> jobStore.logs(jobId));
    }

    /**
     * Cancel a job. A queued job is cancelled at once; a running job stops starting new devices
     * and becomes cancelled when the devices already in flight finish.
     *
     * @return Mono with the job after the request was recorded
     * @throws IllegalStateException (as error signal) if the job is already terminal
     */
    public Mono<Job> cancelJob(String jobId, TenantContext tenant) {
        JobRun run = runs.get(jobId);
        if (run == null) {
            return cancelStored(jobId, tenant);
        }
        return checkTenant(run.snapshot(), jobId, tenant)
            .flatMap(job -> switch (run.status()) {
                case QUEUED -> settle(run, JobStatus.CANCELLED, run.cancelIfQueued())
                    .flatMap(cancelled -> withdraw(jobId).thenReturn(cancelled))
                    .switchIfEmpty(Mono.defer(() -> requestCancel(run)));
                case RUNNING -> requestCancel(run);
                default -> Mono.<Job>error(new IllegalStateException(
                    "Job " + jobId + " is already " + run.status().getWireName()));
            })
            .doOnSuccess(job -> log.info("Cancellation of job {} requested by {}: now {}",
                jobId, tenant.getUserId(), job.getStatus().getWireName()));
    }

    /**
     * Completes with the job once it reaches a terminal state
     */
    public Mono<Job> whenTerminal(String jobId) {
        JobRun run = runs.get(jobId);
        if (run != null) {
            return run.whenTerminal();
        }
        return jobStore.get(jobId)
            .filter(job -> job.getStatus().isTerminal())
            .switchIfEmpty(Mono.error(() -> new JobNotFoundException(jobId)));
    }

    public int getActiveJobCount() {
        return (int) runs.values().stream()
            .filter(run -> run.status().isActive())
            .count();
    }

    /**
     * Take ownership of a consumed queue entry
     *
     * @return Mono with the run, or empty if the job is gone or no longer queued
     */
    Mono<JobRun> claim(String jobId) {
        JobRun local = runs.get(jobId);
        Mono<JobRun> run = local != null
            ? Mono.just(local)
            : jobStore.get(jobId)
                .retryWhen(retry)
                .map(job -> runs.computeIfAbsent(jobId, id -> new JobRun(job, jobStore, broadcast, retry)));

        return run
            .filter(candidate -> {
                if (candidate.status() != JobStatus.QUEUED) {
                    log.info("Skipping job {}: status is {}", jobId, candidate.status().getWireName());
                    return false;
                }
                return true;
            })
            .switchIfEmpty(Mono.fromRunnable(() -> log.debug("Job {} is not claimable", jobId)));
    }

    /**
     * Move a claimed job to running
     *
     * @throws IllegalJobTransitionException if the job was cancelled in the meantime
     */
    Job start(JobRun run) {
        Job job = run.transition(JobStatus.RUNNING);
        webhookNotifier.notifyIfRequested(job).subscribe();
        return job;
    }

    /**
     * Move a job to a terminal state and release it
     */
    Mono<Job> finish(JobRun run, JobStatus status, JobSummary summary) {
        return settle(run, status, Mono.defer(() -> run.finish(status, summary)));
    }

    private Mono<Job> settle(JobRun run, JobStatus status, Mono<Job> finished) {
        return finished
            .onErrorResume(PersistenceFailureException.class, e -> {
                log.error("Job {} finished as {} but could not be persisted; keeping it in memory",
                    run.getJobId(), status.getWireName(), e);
                persistenceFailureCounter.increment();
                return Mono.fromCallable(run::snapshot);
            })
            .doOnNext(job -> {
                Counter.builder("netpilot.jobs.completed")
                    .description("Number of jobs that reached a terminal state")
                    .tag("status", status.getWireName())
                    .register(meterRegistry)
                    .increment();
                if (run.isPersisted()) {
                    runs.remove(run.getJobId(), run);
                }
                run.signalTerminal(job);
                webhookNotifier.notifyIfRequested(job).subscribe();
                log.info("Job {} finished: {} {}", job.getId(), status.getWireName(), job.getSummary());
            });
    }

    /**
     * Per-device timeout for a job
     */
    Duration timeoutFor(Job job) {
        Integer seconds = job.getPayload() != null ? job.getPayload().getTimeoutSeconds() : null;
        return seconds != null ? Duration.ofSeconds(seconds) : properties.getDispatch().getDefaultTimeout();
    }

    private Mono<Boolean> withdraw(String jobId) {
        return jobQueue.withdraw(jobId)
            .onErrorResume(e -> {
                log.warn("Could not remove job {} from queue: {}", jobId, e.getMessage());
                return Mono.just(false);
            });
    }

    private Mono<Job> requestCancel(JobRun run) {
        return Mono.fromCallable(() -> {
            run.requestCancel();
            return run.snapshot();
        });
    }

    private Mono<Job> cancelStored(String jobId, TenantContext tenant) {
        return jobStore.get(jobId)
            .switchIfEmpty(Mono.error(() -> new JobNotFoundException(jobId)))
            .flatMap(job -> checkTenant(job, jobId, tenant))
            .flatMap(job -> {
                if (job.getStatus() != JobStatus.QUEUED) {
                    return Mono.error(new IllegalStateException("Job " + jobId + " is "
                        + job.getStatus().getWireName() + " and not owned by this instance"));
                }
                Job cancelled = job.toBuilder()
                    .status(JobStatus.CANCELLED)
                    .finishedAt(Instant.now())
                    .build();
                return jobQueue.withdraw(jobId)
                    .then(jobStore.setStatus(cancelled).retryWhen(retry))
                    .thenReturn(cancelled);
            });
    }

    private Mono<Job> checkTenant(Job job, String jobId, TenantContext tenant) {
        if (!tenant.getTenantId().equals(job.getTenantId())) {
            return Mono.error(new JobNotFoundException(jobId));
        }
        return Mono.just(job);
    }

    private Mono<Void> validateTimeout(JobSubmission submission) {
        Integer seconds = submission.getPayload() != null ? submission.getPayload().getTimeoutSeconds() : null;
        if (seconds == null) {
            return Mono.empty();
        }
        Duration max = properties.getDispatch().getMaxTimeout();
        if (seconds <= 0 || seconds > max.toSeconds()) {
            return Mono.error(new IllegalArgumentException(
                "timeoutSeconds must be between 1 and " + max.toSeconds()));
        }
        return Mono.empty();
    }

    private Job newJob(JobSubmission submission, TenantContext tenant) {
        return Job.builder()
            .id(generateJobId())
            .type(submission.getType())
            .status(JobStatus.QUEUED)
            .requestedBy(tenant.getUserId())
            .tenantId(tenant.getTenantId())
            .targets(submission.getTargets())
            .payload(submission.getPayload())
            .previewJobId(submission.getPreviousJobId())
            .createdAt(Instant.now())
            .scheduledFor(submission.getExecuteAt())
            .notifications(submission.getNotifications())
            .build();
    }

    private Mono<String> createAndEnqueue(Job job) {
        return jobStore.create(job)
            .retryWhen(retry)
            .onErrorMap(e -> new PersistenceFailureException("Job " + job.getId() + " could not be created", e))
            .then(Mono.defer(() -> {
                JobRun run = new JobRun(job, jobStore, broadcast, retry);
                runs.put(job.getId(), run);
                run.append(JobLogEntry.info(null, submittedMessage(job)));

                return jobQueue.enqueue(QueuedJob.of(job, Instant.now()))
                    .onErrorResume(e -> {
                        log.error("Failed to enqueue job {}", job.getId(), e);
                        run.append(JobLogEntry.error(null, "Could not be queued: " + e.getMessage()));
                        return finish(run, JobStatus.FAILED, JobSummary.empty())
                            .then(Mono.<Void>error(new PersistenceFailureException("Job " + job.getId() + " could not be queued", e)));
                    });
            }))
            .thenReturn(job.getId());
    }

    private static String submittedMessage(Job job) {
        StringBuilder message = new StringBuilder("Submitted ")
            .append(job.getType().getWireName())
            .append(" by ")
            .append(job.getRequestedBy());
        if (job.getPreviewJobId() != null) {
            message.append(", committing preview ").append(job.getPreviewJobId());
        }
        if (job.getScheduledFor() != null) {
            message.append(", scheduled for ").append(job.getScheduledFor());
        }
        return message.toString();
    }

    /**
     * Generate unique job ID
     */
    private String generateJobId() {
        return "job-" + UUID.randomUUID();
    }
}
