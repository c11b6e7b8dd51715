package com.whereq.netpilot.handler;

import com.whereq.netpilot.dispatch.DispatchPlan;
import com.whereq.netpilot.model.DeviceTarget;
import com.whereq.netpilot.model.Job;
import com.whereq.netpilot.model.JobSubmission;
import com.whereq.netpilot.model.JobType;
import com.whereq.netpilot.model.TenantContext;
import com.whereq.netpilot.pipeline.ConfigChangePipeline;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Applies a verified preview
 */
@Component
@RequiredArgsConstructor
public class DeployCommitHandler implements JobHandler {

    private final ConfigChangePipeline pipeline;

    @Override
    public JobType getType() {
        return JobType.DEPLOY_COMMIT;
    }

    @Override
    public Mono<JobSubmission> prepare(JobSubmission submission, TenantContext tenant) {
        return pipeline.prepareCommit(submission, tenant);
    }

    @Override
    public Mono<DispatchPlan> plan(Job job, List<DeviceTarget> targets) {
        return pipeline.planCommit(job, targets);
    }
}
