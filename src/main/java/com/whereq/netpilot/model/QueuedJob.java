package com.whereq.netpilot.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.time.Instant;

/**
 * Queue entry handed from submission to the background processor.
 * Only the reference travels through the queue; the job itself lives in the job store.
 */
@Value
@Builder
@Jacksonized
public class QueuedJob {

    String jobId;

    String tenantId;

    JobType type;

    /**
     * Earliest dispatch time, null for immediate jobs
     */
    Instant executeAt;

    Instant enqueuedAt;

    public static QueuedJob of(Job job, Instant now) {
        return QueuedJob.builder()
            .jobId(job.getId())
            .tenantId(job.getTenantId())
            .type(job.getType())
            .executeAt(job.getScheduledFor())
            .enqueuedAt(now)
            .build();
    }

    /**
     * Time left before the job may be dispatched; zero once due
     */
    public Duration delayFrom(Instant now) {
        if (executeAt == null || !executeAt.isAfter(now)) {
            return Duration.ZERO;
        }
        return Duration.between(now, executeAt);
    }
}
