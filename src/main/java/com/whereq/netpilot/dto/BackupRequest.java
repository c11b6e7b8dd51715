package com.whereq.netpilot.dto;

import com.whereq.netpilot.model.JobPayload;
import com.whereq.netpilot.model.JobSubmission;
import com.whereq.netpilot.model.JobType;
import com.whereq.netpilot.model.Notifications;
import com.whereq.netpilot.model.TargetSpec;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request to back up running configurations
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Back up the running configuration of the targeted devices")
public class BackupRequest {

    @NotNull
    @Valid
    private TargetSpec targets;

    /**
     * Stored with each snapshot, defaults to "manual"
     */
    @Schema(example = "nightly")
    private String sourceLabel;

    private Integer timeoutSeconds;

    private Instant executeAt;

    @Valid
    private Notifications notifications;

    public JobSubmission toSubmission() {
        return JobSubmission.builder()
            .type(JobType.BACKUP)
            .targets(targets)
            .payload(JobPayload.builder()
                .sourceLabel(sourceLabel)
                .timeoutSeconds(timeoutSeconds)
                .build())
            .executeAt(executeAt)
            .notifications(notifications)
            .build();
    }
}
