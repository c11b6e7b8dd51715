package com.whereq.netpilot.controller;

import com.whereq.netpilot.broadcast.BroadcastChannel;
import com.whereq.netpilot.dto.BackupRequest;
import com.whereq.netpilot.dto.CommandRunRequest;
import com.whereq.netpilot.dto.DeployCommitRequest;
import com.whereq.netpilot.dto.DeployPreviewRequest;
import com.whereq.netpilot.dto.JobCancellationResponse;
import com.whereq.netpilot.dto.JobStatusResponse;
import com.whereq.netpilot.dto.JobSubmitResponse;
import com.whereq.netpilot.exception.ConfirmationRequiredException;
import com.whereq.netpilot.exception.InvalidTargetException;
import com.whereq.netpilot.exception.JobNotFoundException;
import com.whereq.netpilot.exception.PersistenceFailureException;
import com.whereq.netpilot.exception.QuotaExceededException;
import com.whereq.netpilot.exception.StalePreviewException;
import com.whereq.netpilot.model.JobEvent;
import com.whereq.netpilot.model.JobLogEntry;
import com.whereq.netpilot.model.JobSubmission;
import com.whereq.netpilot.model.TenantContext;
import com.whereq.netpilot.service.JobLifecycleManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;

/**
 * Controller for async automation job submission and management.
 * Tenant and caller arrive in the {@code X-Tenant-Id} and {@code X-User-Id} headers.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/jobs")
@RequiredArgsConstructor
@Tag(name = "Jobs", description = "Submit, inspect and cancel automation jobs")
public class JobController {

    static final String TENANT_HEADER = "X-Tenant-Id";
    static final String USER_HEADER = "X-User-Id";

    private final JobLifecycleManager lifecycleManager;
    private final BroadcastChannel broadcast;

    @PostMapping("/commands")
    @Operation(summary = "Run commands", description = "Run CLI commands on the targeted devices")
    public Mono<ResponseEntity<JobSubmitResponse>> runCommands(
            @Valid @RequestBody CommandRunRequest request,
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId,
            @RequestHeader(value = USER_HEADER, required = false) String userId) {
        return submit(request.toSubmission(), tenantId, userId);
    }

    @PostMapping("/backups")
    @Operation(summary = "Back up configurations", description = "Snapshot running configurations that changed")
    public Mono<ResponseEntity<JobSubmitResponse>> backup(
            @Valid @RequestBody BackupRequest request,
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId,
            @RequestHeader(value = USER_HEADER, required = false) String userId) {
        return submit(request.toSubmission(), tenantId, userId);
    }

    @PostMapping("/deploy/preview")
    @Operation(summary = "Preview a configuration change", description = "Compute per-device diffs without applying them")
    public Mono<ResponseEntity<JobSubmitResponse>> preview(
            @Valid @RequestBody DeployPreviewRequest request,
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId,
            @RequestHeader(value = USER_HEADER, required = false) String userId) {
        return submit(request.toSubmission(), tenantId, userId);
    }

    @PostMapping("/deploy/commit")
    @Operation(summary = "Commit a previewed change", description = "Apply exactly the change reviewed in a preview job")
    public Mono<ResponseEntity<JobSubmitResponse>> commit(
            @Valid @RequestBody DeployCommitRequest request,
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId,
            @RequestHeader(value = USER_HEADER, required = false) String userId) {
        return submit(request.toSubmission(), tenantId, userId);
    }

    @GetMapping("/{jobId}")
    @Operation(summary = "Get job", description = "Job state, summary and per-device results")
    public Mono<ResponseEntity<JobStatusResponse>> getJob(
            @PathVariable String jobId,
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId,
            @RequestHeader(value = USER_HEADER, required = false) String userId) {
        return Mono.fromCallable(() -> TenantContext.of(tenantId, userId))
            .flatMap(tenant -> lifecycleManager.getJob(jobId, tenant))
            .map(details -> ResponseEntity.ok(JobStatusResponse.from(details)))
            .onErrorResume(JobNotFoundException.class, e -> Mono.just(ResponseEntity.notFound().build()))
            .onErrorResume(IllegalArgumentException.class, e -> Mono.just(ResponseEntity.badRequest().build()));
    }

    @GetMapping("/{jobId}/logs")
    @Operation(summary = "Get job log", description = "Audit log entries in the order they were written")
    public Mono<ResponseEntity<List<JobLogEntry>>> getLogs(
            @PathVariable String jobId,
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId,
            @RequestHeader(value = USER_HEADER, required = false) String userId) {
        return Mono.fromCallable(() -> TenantContext.of(tenantId, userId))
            .flatMap(tenant -> lifecycleManager.getLogs(jobId, tenant).collectList())
            .map(ResponseEntity::ok)
            .onErrorResume(JobNotFoundException.class, e -> Mono.just(ResponseEntity.notFound().build()))
            .onErrorResume(IllegalArgumentException.class, e -> Mono.just(ResponseEntity.badRequest().build()));
    }

    @GetMapping(value = "/{jobId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Stream job events", description = "Live status, progress and log events until the job ends")
    public Mono<ResponseEntity<Flux<ServerSentEvent<JobEvent>>>> streamEvents(
            @PathVariable String jobId,
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId,
            @RequestHeader(value = USER_HEADER, required = false) String userId) {
        return Mono.fromCallable(() -> TenantContext.of(tenantId, userId))
            .flatMap(tenant -> lifecycleManager.getJob(jobId, tenant))
            .map(details -> {
                Flux<JobEvent> events = details.getJob().getStatus().isTerminal()
                    ? Flux.just(JobEvent.status(jobId, details.getJob().getStatus()))
                    : liveEvents(jobId);
                return ResponseEntity.ok(events.map(event -> ServerSentEvent.builder(event)
                    .event(event.getType().name().toLowerCase())
                    .build()));
            })
            .onErrorResume(JobNotFoundException.class, e -> Mono.just(ResponseEntity.notFound().build()))
            .onErrorResume(IllegalArgumentException.class, e -> Mono.just(ResponseEntity.badRequest().build()));
    }

    /**
     * Broadcast events until the terminal status. The channel is subscribed before the terminal
     * state is looked up, so a job finishing in between still ends the stream.
     */
    private Flux<JobEvent> liveEvents(String jobId) {
        Mono<JobEvent> settled = lifecycleManager.whenTerminal(jobId)
            .map(job -> JobEvent.status(jobId, job.getStatus()))
            .onErrorResume(JobNotFoundException.class, e -> Mono.empty());
        return Flux.merge(broadcast.subscribe(jobId), settled)
            .takeUntil(event -> event.getType() == JobEvent.Type.STATUS && event.getStatus().isTerminal());
    }

    @DeleteMapping("/{jobId}")
    @Operation(summary = "Cancel job", description = "Cancel a queued job, or stop a running job from starting new devices")
    public Mono<ResponseEntity<JobCancellationResponse>> cancelJob(
            @PathVariable String jobId,
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId,
            @RequestHeader(value = USER_HEADER, required = false) String userId) {

        log.info("Job cancellation request for {} from user {}", jobId, userId);

        return Mono.fromCallable(() -> TenantContext.of(tenantId, userId))
            .flatMap(tenant -> lifecycleManager.cancelJob(jobId, tenant))
            .map(job -> ResponseEntity.ok(JobCancellationResponse.from(job)))
            .onErrorResume(JobNotFoundException.class, e -> Mono.just(ResponseEntity.notFound().build()))
            .onErrorResume(IllegalArgumentException.class, e -> Mono.just(ResponseEntity.badRequest().build()))
            .onErrorResume(IllegalStateException.class, e -> {
                log.warn("Invalid state for cancellation: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .status(HttpStatus.CONFLICT)
                    .body(JobCancellationResponse.builder().jobId(jobId).message(e.getMessage()).build()));
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Error cancelling job {}", jobId, e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .build());
            });
    }

    private Mono<ResponseEntity<JobSubmitResponse>> submit(JobSubmission submission, String tenantId, String userId) {
        return Mono.fromCallable(() -> TenantContext.of(tenantId, userId))
            .flatMap(tenant -> lifecycleManager.submit(submission, tenant))
            .map(jobId -> ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .location(URI.create("/api/v1/jobs/" + jobId))
                .body(JobSubmitResponse.accepted(jobId)))
            .onErrorResume(InvalidTargetException.class, e -> {
                JobSubmitResponse body = JobSubmitResponse.error(e.getMessage());
                body.setInvalidDeviceIds(e.getDeviceIds());
                return Mono.just(ResponseEntity.badRequest().body(body));
            })
            .onErrorResume(ConfirmationRequiredException.class, e -> {
                JobSubmitResponse body = JobSubmitResponse.error(e.getMessage());
                body.setFlaggedCommands(e.getFlaggedCommands());
                return Mono.just(ResponseEntity.status(HttpStatus.CONFLICT).body(body));
            })
            .onErrorResume(StalePreviewException.class, e -> Mono.just(ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(JobSubmitResponse.error(e.getMessage()))))
            .onErrorResume(QuotaExceededException.class, e -> Mono.just(ResponseEntity
                .status(HttpStatus.TOO_MANY_REQUESTS)
                .body(JobSubmitResponse.error(e.getMessage()))))
            .onErrorResume(IllegalArgumentException.class, e -> Mono.just(ResponseEntity
                .badRequest()
                .body(JobSubmitResponse.error(e.getMessage()))))
            .onErrorResume(PersistenceFailureException.class, e -> {
                log.error("Job store unavailable during submission", e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(JobSubmitResponse.error(e.getMessage())));
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Unexpected error during job submission", e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(JobSubmitResponse.error("Internal server error: " + e.getMessage())));
            });
    }
}
