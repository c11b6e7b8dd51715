package com.whereq.netpilot.dto;

import com.whereq.netpilot.model.JobPayload;
import com.whereq.netpilot.model.JobSubmission;
import com.whereq.netpilot.model.JobType;
import com.whereq.netpilot.model.Notifications;
import com.whereq.netpilot.model.TargetSpec;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Request to run CLI commands on a set of devices.
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Run commands on the targeted devices")
public class CommandRunRequest {

    @NotNull
    @Valid
    private TargetSpec targets;

    @NotEmpty
    @Schema(example = "[\"show version\", \"show ip interface brief\"]")
    private List<String> commands;

    /**
     * Per-device timeout; the server default applies when omitted
     */
    @Schema(example = "30")
    private Integer timeoutSeconds;

    /**
     * Required when any command is classified as dangerous
     */
    private boolean confirm;

    /**
     * Earliest dispatch time
     */
    private Instant executeAt;

    @Valid
    private Notifications notifications;

    public JobSubmission toSubmission() {
        return JobSubmission.builder()
            .type(JobType.RUN_COMMANDS)
            .targets(targets)
            .payload(JobPayload.builder()
                .commands(commands)
                .timeoutSeconds(timeoutSeconds)
                .build())
            .confirmed(confirm)
            .executeAt(executeAt)
            .notifications(notifications)
            .build();
    }
}
