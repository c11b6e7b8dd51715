package com.whereq.netpilot.dto;

import com.whereq.netpilot.model.ConfigMode;
import com.whereq.netpilot.model.JobPayload;
import com.whereq.netpilot.model.JobSubmission;
import com.whereq.netpilot.model.JobType;
import com.whereq.netpilot.model.Notifications;
import com.whereq.netpilot.model.TargetSpec;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request to preview a configuration change
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Compute per-device diffs for a configuration snippet without applying it")
public class DeployPreviewRequest {

    @NotNull
    @Valid
    private TargetSpec targets;

    @NotBlank
    @Schema(example = "interface Lo10\n description X")
    private String snippet;

    @Builder.Default
    @Schema(example = "merge")
    private ConfigMode mode = ConfigMode.MERGE;

    private Integer timeoutSeconds;

    private Instant executeAt;

    @Valid
    private Notifications notifications;

    public JobSubmission toSubmission() {
        return JobSubmission.builder()
            .type(JobType.DEPLOY_PREVIEW)
            .targets(targets)
            .payload(JobPayload.builder()
                .snippet(snippet)
                .mode(mode)
                .timeoutSeconds(timeoutSeconds)
                .build())
            .executeAt(executeAt)
            .notifications(notifications)
            .build();
    }
}
