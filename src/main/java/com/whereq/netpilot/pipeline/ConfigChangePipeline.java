package com.whereq.netpilot.pipeline;

import com.whereq.netpilot.config.NetPilotProperties;
import com.whereq.netpilot.config.NetPilotProperties.MissingDevicePolicy;
import com.whereq.netpilot.dispatch.DispatchItem;
import com.whereq.netpilot.dispatch.DispatchOutcome;
import com.whereq.netpilot.dispatch.DispatchPlan;
import com.whereq.netpilot.exception.ConfirmationRequiredException;
import com.whereq.netpilot.exception.InvalidTargetException;
import com.whereq.netpilot.exception.StalePreviewException;
import com.whereq.netpilot.executor.ConfigApply;
import com.whereq.netpilot.model.ConfigMode;
import com.whereq.netpilot.model.DeviceResult;
import com.whereq.netpilot.model.DeviceTarget;
import com.whereq.netpilot.model.Job;
import com.whereq.netpilot.model.JobPayload;
import com.whereq.netpilot.model.JobSubmission;
import com.whereq.netpilot.model.JobType;
import com.whereq.netpilot.model.PreviewRecord;
import com.whereq.netpilot.model.TenantContext;
import com.whereq.netpilot.store.JobStore;
import com.whereq.netpilot.store.PreviewStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Two-phase configuration deployment.
 * <p>
 * A preview computes per-device diffs and stores them as a {@link PreviewRecord}. A commit
 * names the preview job, and may only apply the exact snippet and mode recorded there, to
 * devices the preview covered. Verification runs when the commit is submitted and again
 * right before it is dispatched.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConfigChangePipeline {

    static final String PREVIEW_FAILED_REASON = "No reviewed diff: preview failed on this device";
    static final String DEVICE_REMOVED_REASON = "Device no longer in inventory";

    private final JobStore jobStore;
    private final PreviewStore previewStore;
    private final NetPilotProperties properties;

    /**
     * Persist the diffs of a finished preview job
     */
    public Mono<Void> recordPreview(Job previewJob, DispatchOutcome outcome) {
        PreviewRecord.PreviewRecordBuilder record = PreviewRecord.builder()
            .previewJobId(previewJob.getId())
            .tenantId(previewJob.getTenantId())
            .targets(previewJob.getTargets())
            .mode(previewJob.getPayload().getMode())
            .snippet(previewJob.getPayload().getSnippet())
            .fingerprint(previewJob.getPayload().configFingerprint())
            .createdAt(Instant.now());

        for (DeviceResult result : outcome.getResults()) {
            if (result.isSuccess()) {
                record.diff(result.getDeviceId(), result.getOutput());
            } else {
                record.failedDeviceId(result.getDeviceId());
            }
        }

        return previewStore.save(record.build(), properties.effectivePreviewRetention());
    }

    /**
     * Turn a commit request into a job submission whose targets and payload are taken from the
     * referenced preview
     *
     * @throws ConfirmationRequiredException if the commit was not confirmed
     * @throws StalePreviewException if the preview cannot be verified or the request payload drifts from it
     */
    public Mono<JobSubmission> prepareCommit(JobSubmission submission, TenantContext tenant) {
        if (!submission.isConfirmed()) {
            return Mono.error(new ConfirmationRequiredException(
                "Committing a configuration change requires confirm=true", List.of()));
        }
        if (submission.getPreviousJobId() == null || submission.getPreviousJobId().isBlank()) {
            return Mono.error(new IllegalArgumentException("previousJobId is required"));
        }

        return loadVerifiedPreview(submission.getPreviousJobId(), tenant.getTenantId())
            .map(record -> {
                checkNoDrift(submission.getPayload(), record);

                JobPayload payload = JobPayload.builder()
                    .snippet(record.getSnippet())
                    .mode(record.getMode())
                    .timeoutSeconds(submission.getPayload() != null ? submission.getPayload().getTimeoutSeconds() : null)
                    .build();

                return submission.toBuilder()
                    .targets(record.getTargets())
                    .payload(payload)
                    .build();
            });
    }

    /**
     * Plan the apply step against the devices resolved now
     *
     * @throws InvalidTargetException for resolved devices the preview never covered
     * @throws StalePreviewException if the preview no longer verifies, or a previewed device vanished under the reject policy
     */
    public Mono<DispatchPlan> planCommit(Job commitJob, List<DeviceTarget> targets) {
        return loadVerifiedPreview(commitJob.getPreviewJobId(), commitJob.getTenantId())
            .map(record -> {
                if (!record.getFingerprint().equals(commitJob.getPayload().configFingerprint())) {
                    throw new StalePreviewException("Commit payload of job " + commitJob.getId()
                        + " differs from preview " + record.getPreviewJobId());
                }
                return buildCommitPlan(record, targets);
            });
    }

    private DispatchPlan buildCommitPlan(PreviewRecord record, List<DeviceTarget> targets) {
        Set<Long> covered = record.coveredDeviceIds();

        Set<Long> uncovered = new TreeSet<>();
        Set<Long> resolved = new TreeSet<>();
        for (DeviceTarget target : targets) {
            resolved.add(target.getDeviceId());
            if (!covered.contains(target.getDeviceId())) {
                uncovered.add(target.getDeviceId());
            }
        }
        if (!uncovered.isEmpty()) {
            throw new InvalidTargetException("Devices " + uncovered + " were not part of preview "
                + record.getPreviewJobId(), uncovered);
        }

        Set<Long> missing = new TreeSet<>(covered);
        missing.removeAll(resolved);
        if (!missing.isEmpty() && properties.getPreview().getMissingDevicePolicy() == MissingDevicePolicy.REJECT) {
            throw new StalePreviewException("Previewed devices " + missing + " are no longer in inventory");
        }

        List<DispatchItem> items = new ArrayList<>();
        ConfigApply apply = new ConfigApply(record.getSnippet(), record.getMode());
        for (DeviceTarget target : targets) {
            if (record.hasReviewedDiff(target.getDeviceId())) {
                items.add(DispatchItem.run(target, apply));
            } else {
                items.add(DispatchItem.skip(target, PREVIEW_FAILED_REASON));
            }
        }
        for (Long deviceId : missing) {
            items.add(DispatchItem.skip(DeviceTarget.builder().deviceId(deviceId).build(), DEVICE_REMOVED_REASON));
        }
        items.sort(Comparator.comparingLong(item -> item.getTarget().getDeviceId()));

        if (!missing.isEmpty()) {
            log.warn("Preview {}: devices {} vanished since preview and will be skipped", record.getPreviewJobId(), missing);
        }
        return new DispatchPlan(items);
    }

    /**
     * Load the preview record after checking the job it came from
     */
    private Mono<PreviewRecord> loadVerifiedPreview(String previewJobId, String tenantId) {
        return jobStore.get(previewJobId)
            .filter(job -> tenantId.equals(job.getTenantId()))
            .switchIfEmpty(Mono.error(() -> new StalePreviewException("Preview job " + previewJobId + " not found")))
            .flatMap(job -> {
                if (job.getType() != JobType.DEPLOY_PREVIEW) {
                    return Mono.error(new StalePreviewException("Job " + previewJobId + " is not a deploy_preview job"));
                }
                if (!job.getStatus().isCommittable()) {
                    return Mono.error(new StalePreviewException("Preview job " + previewJobId + " is "
                        + job.getStatus().getWireName() + ", not committable"));
                }
                return previewStore.find(previewJobId)
                    .switchIfEmpty(Mono.error(() -> new StalePreviewException(
                        "Preview record for job " + previewJobId + " has expired")))
                    .map(record -> verifyRecord(job, record));
            });
    }

    private PreviewRecord verifyRecord(Job previewJob, PreviewRecord record) {
        JobPayload recorded = JobPayload.builder().snippet(record.getSnippet()).mode(record.getMode()).build();
        String fingerprint = recorded.configFingerprint();
        if (!fingerprint.equals(record.getFingerprint())
                || !fingerprint.equals(previewJob.getPayload().configFingerprint())
                || !previewJob.getTenantId().equals(record.getTenantId())) {
            throw new StalePreviewException("Preview record for job " + previewJob.getId() + " does not match its job");
        }
        return record;
    }

    private static void checkNoDrift(JobPayload requested, PreviewRecord record) {
        if (requested == null) {
            return;
        }
        String snippet = requested.getSnippet();
        ConfigMode mode = requested.getMode();
        if (snippet != null && !snippet.equals(record.getSnippet())) {
            throw new StalePreviewException("Snippet differs from the one reviewed in preview " + record.getPreviewJobId());
        }
        if (mode != null && mode != record.getMode()) {
            throw new StalePreviewException("Mode " + mode.getWireName() + " differs from preview "
                + record.getPreviewJobId() + " (" + record.getMode().getWireName() + ")");
        }
    }
}
