package com.whereq.netpilot.dto;

import com.whereq.netpilot.model.Job;
import com.whereq.netpilot.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for job cancellation
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobCancellationResponse {
    /**
     * Job identifier
     */
    private String jobId;

    /**
     * CANCELLED for queued jobs; RUNNING while in-flight devices drain
     */
    private JobStatus status;

    /**
     * When the cancellation was requested
     */
    private Instant requestedAt;

    /**
     * Cancellation message
     */
    private String message;

    public static JobCancellationResponse from(Job job) {
        return JobCancellationResponse.builder()
            .jobId(job.getId())
            .status(job.getStatus())
            .requestedAt(Instant.now())
            .message(job.getStatus() == JobStatus.CANCELLED
                ? "Job cancelled"
                : "Cancellation requested; devices already in progress will finish")
            .build();
    }
}
