package com.whereq.netpilot.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.netpilot.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Response for async job submission
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobSubmitResponse {
    /**
     * Unique job identifier
     */
    private String jobId;

    /**
     * Current job status
     */
    private JobStatus status;

    /**
     * When the job was submitted
     */
    private Instant submittedAt;

    /**
     * Error message (if submission failed)
     */
    private String errorMessage;

    /**
     * Commands that need confirmation (if rejected for that reason)
     */
    private List<String> flaggedCommands;

    /**
     * Device identifiers that failed target validation
     */
    private List<Long> invalidDeviceIds;

    public static JobSubmitResponse accepted(String jobId) {
        return JobSubmitResponse.builder()
            .jobId(jobId)
            .status(JobStatus.QUEUED)
            .submittedAt(Instant.now())
            .build();
    }

    /**
     * Create error response
     */
    public static JobSubmitResponse error(String message) {
        return JobSubmitResponse.builder()
            .errorMessage(message)
            .submittedAt(Instant.now())
            .build();
    }
}
