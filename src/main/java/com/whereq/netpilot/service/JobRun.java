package com.whereq.netpilot.service;

import com.whereq.netpilot.broadcast.BroadcastChannel;
import com.whereq.netpilot.dispatch.DispatchListener;
import com.whereq.netpilot.exception.IllegalJobTransitionException;
import com.whereq.netpilot.exception.PersistenceFailureException;
import com.whereq.netpilot.handler.JobAudit;
import com.whereq.netpilot.model.DeviceResult;
import com.whereq.netpilot.model.DeviceTarget;
import com.whereq.netpilot.model.Job;
import com.whereq.netpilot.model.JobDetails;
import com.whereq.netpilot.model.JobEvent;
import com.whereq.netpilot.model.JobLogEntry;
import com.whereq.netpilot.model.JobProgress;
import com.whereq.netpilot.model.JobStatus;
import com.whereq.netpilot.model.JobSummary;
import com.whereq.netpilot.store.JobStore;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * In-memory handle of one job while this process owns it.
 * <p>
 * Holds the authoritative state, enforces the state machine and refuses appends once the job is
 * terminal. Store writes and broadcasts go through a per-job serial pipeline so that they happen
 * in the order the changes were made. Writes that still fail after retries are buffered and
 * flushed when the job finishes.
 */
@Slf4j
class JobRun implements DispatchListener, JobAudit {

    private final Job job;
    private final List<DeviceResult> results = new ArrayList<>();
    private final List<JobLogEntry> logs = new ArrayList<>();

    private final JobStore jobStore;
    private final BroadcastChannel broadcast;
    private final RetryBackoffSpec retry;

    private final Sinks.Many<Mono<Void>> steps = Sinks.many().unicast().onBackpressureBuffer();
    private final Mono<Void> drained;

    private final List<DeviceResult> pendingResults = new ArrayList<>();
    private final List<JobLogEntry> pendingLogs = new ArrayList<>();
    private boolean statusPending;

    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private final Sinks.One<Job> terminal = Sinks.one();
    private volatile boolean persisted = true;

    JobRun(Job job, JobStore jobStore, BroadcastChannel broadcast, RetryBackoffSpec retry) {
        this.job = job.toBuilder().build();
        this.jobStore = jobStore;
        this.broadcast = broadcast;
        this.retry = retry;
        this.drained = steps.asFlux()
            .concatMap(Function.identity())
            .then()
            .cache();
        this.drained.subscribe();
    }

    String getJobId() {
        return job.getId();
    }

    synchronized Job snapshot() {
        return job.toBuilder().build();
    }

    synchronized JobStatus status() {
        return job.getStatus();
    }

    synchronized JobDetails details() {
        List<DeviceResult> ordered = new ArrayList<>(results);
        ordered.sort(Comparator.comparingLong(DeviceResult::getDeviceId));
        return new JobDetails(snapshot(), ordered);
    }

    synchronized List<JobLogEntry> logs() {
        return new ArrayList<>(logs);
    }

    boolean isCancelRequested() {
        return cancelRequested.get();
    }

    void requestCancel() {
        if (cancelRequested.compareAndSet(false, true)) {
            append(JobLogEntry.warn(null, "Cancellation requested; no new devices will be started"));
        }
    }

    /**
     * False once a terminal flush exhausted its retries
     */
    boolean isPersisted() {
        return persisted;
    }

    Mono<Job> whenTerminal() {
        return terminal.asMono();
    }

    void signalTerminal(Job finished) {
        terminal.tryEmitValue(finished);
    }

    /**
     * Move to a non-terminal state
     *
     * @throws IllegalJobTransitionException if the state machine forbids it
     */
    synchronized Job transition(JobStatus next) {
        if (next.isTerminal()) {
            throw new IllegalArgumentException("Use finish() for terminal state " + next);
        }
        applyTransition(next, null);
        return snapshot();
    }

    /**
     * Move to a terminal state, then drain pending writes
     *
     * @return Mono with the final job, or an error if the job could not be persisted
     * @throws IllegalJobTransitionException if the job is already terminal
     */
    Mono<Job> finish(JobStatus next, JobSummary summary) {
        synchronized (this) {
            if (!next.isTerminal()) {
                throw new IllegalArgumentException(next + " is not a terminal state");
            }
            applyTransition(next, summary);
            steps.tryEmitComplete();
        }
        return drain();
    }

    /**
     * Cancel the job only while it is still queued. The check and the transition happen under
     * the same lock that guards the move to running.
     *
     * @return Mono with the cancelled job, or empty if the job already left the queued state
     */
    Mono<Job> cancelIfQueued() {
        synchronized (this) {
            if (job.getStatus() != JobStatus.QUEUED) {
                return Mono.empty();
            }
            cancelRequested.set(true);
            applyTransition(JobStatus.CANCELLED, JobSummary.empty());
            steps.tryEmitComplete();
        }
        return drain();
    }

    private Mono<Job> drain() {
        return drained
            .then(Mono.defer(this::flushPending))
            .doOnError(e -> persisted = false)
            .then(Mono.fromCallable(this::snapshot));
    }

    private void applyTransition(JobStatus next, JobSummary summary) {
        JobStatus current = job.getStatus();
        if (!current.canTransitionTo(next)) {
            throw new IllegalJobTransitionException(job.getId(), current, next);
        }
        Instant now = Instant.now();
        job.setStatus(next);
        if (next == JobStatus.RUNNING) {
            job.setStartedAt(now);
        }
        if (next.isTerminal()) {
            job.setFinishedAt(now);
            if (summary != null) {
                job.setSummary(summary);
            }
        }
        log.info("Job {} status: {} -> {}", job.getId(), current.getWireName(), next.getWireName());

        Job written = job.toBuilder().build();
        emit(Mono.defer(() -> jobStore.setStatus(written))
            .retryWhen(retryFor("status of"))
            .onErrorResume(e -> {
                log.warn("Status write for job {} failed, will retry on completion: {}", job.getId(), e.getMessage());
                markStatusPending();
                return Mono.empty();
            })
            .then(publish(JobEvent.status(job.getId(), next))));
    }

    @Override
    public synchronized void append(JobLogEntry entry) {
        checkNotTerminal();
        logs.add(entry);
        JobStatus current = job.getStatus();
        emit(Mono.defer(() -> jobStore.appendLog(job.getId(), entry))
            .retryWhen(retryFor("log of"))
            .onErrorResume(e -> {
                log.warn("Log write for job {} failed, buffering: {}", job.getId(), e.getMessage());
                buffer(pendingLogs, entry);
                return Mono.empty();
            })
            .then(publish(JobEvent.log(job.getId(), current, entry))));
    }

    @Override
    public void onStart(DeviceTarget target) {
        append(JobLogEntry.info(target.getHostname(), "Connecting to " + target.getMgmtAddress()));
    }

    @Override
    public synchronized void onResult(DeviceResult result, JobProgress progress) {
        checkNotTerminal();
        results.add(result);
        JobStatus current = job.getStatus();
        emit(Mono.defer(() -> jobStore.appendResult(job.getId(), result))
            .retryWhen(retryFor("result of"))
            .onErrorResume(e -> {
                log.warn("Result write for job {} device {} failed, buffering: {}",
                    job.getId(), result.getDeviceId(), e.getMessage());
                buffer(pendingResults, result);
                return Mono.empty();
            })
            .then(publish(JobEvent.progress(job.getId(), current, progress, result))));
        append(resultEntry(result));
    }

    private static JobLogEntry resultEntry(DeviceResult result) {
        return switch (result.getStatus()) {
            case SUCCESS -> JobLogEntry.info(result.getHostname(), "Completed in " + result.getDurationMs() + "ms");
            case FAILED -> JobLogEntry.error(result.getHostname(),
                result.getErrorKind().getDescription() + ": " + result.getErrorMessage());
            case SKIPPED -> JobLogEntry.warn(result.getHostname(),
                "Skipped device " + result.getDeviceId() + ": " + result.getErrorMessage());
        };
    }

    private void checkNotTerminal() {
        if (job.getStatus().isTerminal()) {
            throw new IllegalStateException("Job " + job.getId() + " is " + job.getStatus().getWireName()
                + " and can no longer change");
        }
    }

    private void emit(Mono<Void> step) {
        Sinks.EmitResult result = steps.tryEmitNext(step);
        if (result.isFailure()) {
            log.warn("Dropped journal step for job {}: {}", job.getId(), result);
        }
    }

    private Mono<Void> publish(JobEvent event) {
        return Mono.defer(() -> broadcast.publish(job.getId(), event))
            .onErrorResume(e -> {
                log.warn("Broadcast of {} event for job {} failed: {}", event.getType(), job.getId(), e.getMessage());
                return Mono.empty();
            });
    }

    private RetryBackoffSpec retryFor(String what) {
        return retry.doBeforeRetry(signal -> log.debug("Retrying write of {} job {} (attempt {})",
            what, job.getId(), signal.totalRetries() + 1));
    }

    private synchronized <T> void buffer(List<T> pending, T item) {
        pending.add(item);
    }

    private synchronized void markStatusPending() {
        statusPending = true;
    }

    /**
     * Write everything that failed during the run. The final status always goes last.
     */
    private Mono<Void> flushPending() {
        List<DeviceResult> results;
        List<JobLogEntry> logs;
        boolean status;
        synchronized (this) {
            results = new ArrayList<>(pendingResults);
            logs = new ArrayList<>(pendingLogs);
            status = statusPending;
            pendingResults.clear();
            pendingLogs.clear();
            statusPending = false;
        }
        if (results.isEmpty() && logs.isEmpty() && !status) {
            return Mono.empty();
        }

        log.info("Flushing {} results and {} log entries buffered for job {}", results.size(), logs.size(), job.getId());
        return Flux.fromIterable(results)
            .concatMap(result -> Mono.defer(() -> jobStore.appendResult(job.getId(), result)).retryWhen(retry))
            .thenMany(Flux.fromIterable(logs)
                .concatMap(entry -> Mono.defer(() -> jobStore.appendLog(job.getId(), entry)).retryWhen(retry)))
            .then(Mono.defer(() -> jobStore.setStatus(snapshot())).retryWhen(retry))
            .onErrorMap(e -> new PersistenceFailureException("Job " + job.getId() + " could not be persisted", e));
    }
}
