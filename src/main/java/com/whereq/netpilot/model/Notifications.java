package com.whereq.netpilot.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;
import java.util.Set;

/**
 * Webhook subscription attached to a job submission.
 * With no statuses listed, every terminal status is delivered.
 */
@Value
@Builder
@Jacksonized
public class Notifications implements Serializable {
    private static final long serialVersionUID = 1L;

    @Pattern(regexp = "^https?://\\S+$", message = "webhook must be an http(s) URL")
    String webhook;

    @Singular
    Set<JobStatus> statuses;

    @JsonIgnore
    public boolean hasWebhook() {
        return webhook != null && !webhook.isBlank();
    }

    public boolean shouldNotify(JobStatus status) {
        if (!hasWebhook() || status == null) {
            return false;
        }
        return statuses.isEmpty() ? status.isTerminal() : statuses.contains(status);
    }
}
