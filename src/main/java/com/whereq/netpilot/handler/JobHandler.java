package com.whereq.netpilot.handler;

import com.whereq.netpilot.dispatch.DispatchOutcome;
import com.whereq.netpilot.dispatch.DispatchPlan;
import com.whereq.netpilot.model.DeviceTarget;
import com.whereq.netpilot.model.Job;
import com.whereq.netpilot.model.JobSubmission;
import com.whereq.netpilot.model.JobSummary;
import com.whereq.netpilot.model.JobType;
import com.whereq.netpilot.model.TenantContext;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Per job type behaviour. Every type goes through the same lifecycle; handlers only decide
 * what a submission means, what each device does and what happens after dispatch.
 */
public interface JobHandler {

    JobType getType();

    /**
     * Validate and normalize a submission before any job record exists
     *
     * @return Mono with the submission to store, or an error rejecting it
     */
    Mono<JobSubmission> prepare(JobSubmission submission, TenantContext tenant);

    /**
     * Build the per-device work for freshly resolved, non-empty targets.
     * Also called at submission to validate the targets without dispatching.
     */
    Mono<DispatchPlan> plan(Job job, List<DeviceTarget> targets);

    /**
     * Post-dispatch step, run before the job becomes terminal
     *
     * @return Mono with the summary to store on the job
     */
    default Mono<JobSummary> complete(Job job, DispatchOutcome outcome, JobAudit audit) {
        return Mono.just(outcome.getSummary());
    }
}
