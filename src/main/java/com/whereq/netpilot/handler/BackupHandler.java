package com.whereq.netpilot.handler;

import com.whereq.netpilot.dispatch.DispatchOutcome;
import com.whereq.netpilot.dispatch.DispatchPlan;
import com.whereq.netpilot.executor.ConfigFetch;
import com.whereq.netpilot.model.ConfigSnapshot;
import com.whereq.netpilot.model.DeviceResult;
import com.whereq.netpilot.model.DeviceTarget;
import com.whereq.netpilot.model.Job;
import com.whereq.netpilot.model.JobLogEntry;
import com.whereq.netpilot.model.JobPayload;
import com.whereq.netpilot.model.JobSubmission;
import com.whereq.netpilot.model.JobSummary;
import com.whereq.netpilot.model.JobType;
import com.whereq.netpilot.model.TenantContext;
import com.whereq.netpilot.store.ConfigSnapshotStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Fetches running configurations and stores a snapshot for every device whose configuration
 * hash differs from its last snapshot.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BackupHandler implements JobHandler {

    static final String DEFAULT_SOURCE = "manual";

    private final ConfigSnapshotStore snapshotStore;

    @Override
    public JobType getType() {
        return JobType.BACKUP;
    }

    @Override
    public Mono<JobSubmission> prepare(JobSubmission submission, TenantContext tenant) {
        JobPayload payload = submission.getPayload() != null ? submission.getPayload() : new JobPayload();
        if (payload.getSourceLabel() == null || payload.getSourceLabel().isBlank()) {
            payload = payload.toBuilder().sourceLabel(DEFAULT_SOURCE).build();
        }
        return Mono.just(submission.toBuilder().payload(payload).build());
    }

    @Override
    public Mono<DispatchPlan> plan(Job job, List<DeviceTarget> targets) {
        return Mono.just(DispatchPlan.uniform(targets, new ConfigFetch()));
    }

    @Override
    public Mono<JobSummary> complete(Job job, DispatchOutcome outcome, JobAudit audit) {
        return Flux.fromIterable(outcome.getResults())
            .filter(DeviceResult::isSuccess)
            .concatMap(result -> snapshotIfChanged(job, result, audit))
            .filter(Boolean::booleanValue)
            .count()
            .map(changed -> {
                JobSummary summary = outcome.getSummary();
                summary.setChanged(changed.intValue());
                return summary;
            });
    }

    /**
     * @return Mono with true if a new snapshot was stored
     */
    private Mono<Boolean> snapshotIfChanged(Job job, DeviceResult result, JobAudit audit) {
        String config = result.getOutput() != null ? result.getOutput() : "";
        String hash = JobPayload.sha256Hex(config);

        return snapshotStore.latest(result.getDeviceId())
            .map(previous -> !hash.equals(previous.getHash()))
            .defaultIfEmpty(true)
            .flatMap(changed -> {
                if (!changed) {
                    audit.append(JobLogEntry.info(result.getHostname(), "Configuration unchanged"));
                    return Mono.just(false);
                }
                ConfigSnapshot snapshot = ConfigSnapshot.builder()
                    .deviceId(result.getDeviceId())
                    .jobId(job.getId())
                    .source(job.getPayload().getSourceLabel())
                    .hash(hash)
                    .configText(config)
                    .createdAt(Instant.now())
                    .build();
                return snapshotStore.save(snapshot)
                    .doOnSuccess(v -> audit.append(JobLogEntry.info(result.getHostname(),
                        "Configuration changed, snapshot " + hash.substring(0, 12) + " stored")))
                    .thenReturn(true);
            })
            .onErrorResume(e -> {
                log.error("Snapshot failed for device {} in job {}", result.getDeviceId(), job.getId(), e);
                audit.append(JobLogEntry.error(result.getHostname(), "Snapshot failed: " + e.getMessage()));
                return Mono.just(false);
            });
    }
}
