package com.whereq.netpilot.handler;

import com.whereq.netpilot.dispatch.DispatchOutcome;
import com.whereq.netpilot.dispatch.DispatchPlan;
import com.whereq.netpilot.executor.ConfigDiff;
import com.whereq.netpilot.model.ConfigMode;
import com.whereq.netpilot.model.DeviceTarget;
import com.whereq.netpilot.model.Job;
import com.whereq.netpilot.model.JobLogEntry;
import com.whereq.netpilot.model.JobPayload;
import com.whereq.netpilot.model.JobSubmission;
import com.whereq.netpilot.model.JobSummary;
import com.whereq.netpilot.model.JobType;
import com.whereq.netpilot.model.TenantContext;
import com.whereq.netpilot.pipeline.ConfigChangePipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Read-only diff of a snippet on every target; the diffs become the preview record
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeployPreviewHandler implements JobHandler {

    private final ConfigChangePipeline pipeline;

    @Override
    public JobType getType() {
        return JobType.DEPLOY_PREVIEW;
    }

    @Override
    public Mono<JobSubmission> prepare(JobSubmission submission, TenantContext tenant) {
        JobPayload payload = submission.getPayload();
        if (payload == null || payload.getSnippet() == null || payload.getSnippet().isBlank()) {
            return Mono.error(new IllegalArgumentException("A configuration snippet is required"));
        }
        if (payload.getMode() == null) {
            payload = payload.toBuilder().mode(ConfigMode.MERGE).build();
        }
        return Mono.just(submission.toBuilder().payload(payload).build());
    }

    @Override
    public Mono<DispatchPlan> plan(Job job, List<DeviceTarget> targets) {
        JobPayload payload = job.getPayload();
        return Mono.just(DispatchPlan.uniform(targets, new ConfigDiff(payload.getSnippet(), payload.getMode())));
    }

    @Override
    public Mono<JobSummary> complete(Job job, DispatchOutcome outcome, JobAudit audit) {
        return pipeline.recordPreview(job, outcome)
            .doOnSuccess(v -> audit.append(JobLogEntry.info(null,
                "Preview recorded for " + outcome.getSummary().getSucceeded() + " devices")))
            .onErrorResume(e -> {
                log.error("Failed to store preview record for job {}", job.getId(), e);
                audit.append(JobLogEntry.error(null, "Preview record could not be stored; this preview cannot be committed"));
                return Mono.empty();
            })
            .thenReturn(outcome.getSummary());
    }
}
