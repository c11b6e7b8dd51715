package com.whereq.netpilot.handler;

import com.whereq.netpilot.dispatch.DispatchPlan;
import com.whereq.netpilot.executor.CommandBatch;
import com.whereq.netpilot.model.DeviceTarget;
import com.whereq.netpilot.model.Job;
import com.whereq.netpilot.model.JobPayload;
import com.whereq.netpilot.model.JobSubmission;
import com.whereq.netpilot.model.JobType;
import com.whereq.netpilot.model.TenantContext;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs the same command batch on every target. Dangerous commands are gated at admission.
 */
@Component
public class RunCommandsHandler implements JobHandler {

    @Override
    public JobType getType() {
        return JobType.RUN_COMMANDS;
    }

    @Override
    public Mono<JobSubmission> prepare(JobSubmission submission, TenantContext tenant) {
        return Mono.fromCallable(() -> {
            JobPayload payload = submission.getPayload();
            List<String> commands = payload == null || payload.getCommands() == null
                ? List.of()
                : payload.getCommands().stream()
                    .filter(command -> command != null && !command.isBlank())
                    .map(String::trim)
                    .collect(Collectors.toList());
            if (commands.isEmpty()) {
                throw new IllegalArgumentException("At least one command is required");
            }
            return submission.toBuilder()
                .payload(payload.toBuilder().commands(commands).build())
                .build();
        });
    }

    @Override
    public Mono<DispatchPlan> plan(Job job, List<DeviceTarget> targets) {
        return Mono.just(DispatchPlan.uniform(targets, new CommandBatch(job.getPayload().getCommands())));
    }
}
