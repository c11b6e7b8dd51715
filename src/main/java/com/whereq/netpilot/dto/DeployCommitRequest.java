package com.whereq.netpilot.dto;

import com.whereq.netpilot.model.ConfigMode;
import com.whereq.netpilot.model.JobPayload;
import com.whereq.netpilot.model.JobSubmission;
import com.whereq.netpilot.model.JobType;
import com.whereq.netpilot.model.Notifications;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request to commit a previewed configuration change.
 * Targets and payload come from the preview; snippet and mode may be echoed back
 * and must then match the preview exactly.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Apply the configuration change reviewed in a preview job")
public class DeployCommitRequest {

    @NotBlank
    @Schema(description = "Identifier of the deploy_preview job")
    private String previousJobId;

    private boolean confirm;

    private String snippet;

    private ConfigMode mode;

    private Integer timeoutSeconds;

    private Instant executeAt;

    @Valid
    private Notifications notifications;

    public JobSubmission toSubmission() {
        return JobSubmission.builder()
            .type(JobType.DEPLOY_COMMIT)
            .previousJobId(previousJobId)
            .payload(JobPayload.builder()
                .snippet(snippet)
                .mode(mode)
                .timeoutSeconds(timeoutSeconds)
                .build())
            .confirmed(confirm)
            .executeAt(executeAt)
            .notifications(notifications)
            .build();
    }
}
