package com.whereq.netpilot.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A request to create a job, as handed to the lifecycle manager by the API layer
 */
@Value
@Builder(toBuilder = true)
public class JobSubmission {
    JobType type;

    TargetSpec targets;

    JobPayload payload;

    /**
     * Operator confirmed dangerous commands / the commit
     */
    boolean confirmed;

    /**
     * Preview job to commit (deploy_commit only)
     */
    String previousJobId;

    Instant executeAt;

    Notifications notifications;
}
