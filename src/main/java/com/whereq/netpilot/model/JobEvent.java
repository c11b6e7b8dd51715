package com.whereq.netpilot.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Notification published to live consumers on state, progress or log changes
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobEvent {
    Type type;

    String jobId;

    /**
     * Status at the time of the event
     */
    JobStatus status;

    JobProgress progress;

    JobLogEntry log;

    DeviceResult result;

    Instant timestamp;

    public static JobEvent status(String jobId, JobStatus status) {
        return JobEvent.builder().type(Type.STATUS).jobId(jobId).status(status).timestamp(Instant.now()).build();
    }

    public static JobEvent progress(String jobId, JobStatus status, JobProgress progress, DeviceResult result) {
        return JobEvent.builder()
            .type(Type.PROGRESS)
            .jobId(jobId)
            .status(status)
            .progress(progress)
            .result(result)
            .timestamp(Instant.now())
            .build();
    }

    public static JobEvent log(String jobId, JobStatus status, JobLogEntry entry) {
        return JobEvent.builder().type(Type.LOG).jobId(jobId).status(status).log(entry).timestamp(Instant.now()).build();
    }

    public enum Type {
        STATUS,
        PROGRESS,
        LOG
    }
}
