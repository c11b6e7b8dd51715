package com.whereq.netpilot.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.netpilot.model.DeviceResult;
import com.whereq.netpilot.model.Job;
import com.whereq.netpilot.model.JobDetails;
import com.whereq.netpilot.model.JobPayload;
import com.whereq.netpilot.model.JobStatus;
import com.whereq.netpilot.model.JobSummary;
import com.whereq.netpilot.model.JobType;
import com.whereq.netpilot.model.TargetSpec;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Response for job status query
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobStatusResponse {
    /**
     * Job identifier
     */
    private String jobId;

    private JobType type;

    /**
     * Current status
     */
    private JobStatus status;

    private String requestedBy;

    private TargetSpec targets;

    private JobPayload payload;

    /**
     * Preview this commit was derived from
     */
    private String previewJobId;

    /**
     * When the job was submitted
     */
    private Instant createdAt;

    /**
     * Earliest dispatch time (if scheduled)
     */
    private Instant scheduledFor;

    /**
     * When the job started execution
     */
    private Instant startedAt;

    /**
     * When the job reached a terminal state
     */
    private Instant finishedAt;

    private JobSummary summary;

    /**
     * Per-device results, ordered by device identifier
     */
    private List<DeviceResult> results;

    public static JobStatusResponse from(JobDetails details) {
        Job job = details.getJob();
        return JobStatusResponse.builder()
            .jobId(job.getId())
            .type(job.getType())
            .status(job.getStatus())
            .requestedBy(job.getRequestedBy())
            .targets(job.getTargets())
            .payload(job.getPayload())
            .previewJobId(job.getPreviewJobId())
            .createdAt(job.getCreatedAt())
            .scheduledFor(job.getScheduledFor())
            .startedAt(job.getStartedAt())
            .finishedAt(job.getFinishedAt())
            .summary(job.getSummary())
            .results(details.getResults())
            .build();
    }
}
