package com.whereq.netpilot.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A unit of requested automation work
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Job {
    /**
     * Unique job identifier
     */
    private String id;

    private JobType type;

    private JobStatus status;

    /**
     * Identity of the caller who submitted the job
     */
    private String requestedBy;

    /**
     * Tenant the job and its targets belong to
     */
    private String tenantId;

    private TargetSpec targets;

    private JobPayload payload;

    /**
     * Preview job a deploy_commit job was derived from
     */
    private String previewJobId;

    private Instant createdAt;

    /**
     * Earliest dispatch time for scheduled jobs
     */
    private Instant scheduledFor;

    private Instant startedAt;

    private Instant finishedAt;

    @Builder.Default
    private JobSummary summary = JobSummary.empty();

    /**
     * Webhook notification configuration
     */
    private Notifications notifications;
}
