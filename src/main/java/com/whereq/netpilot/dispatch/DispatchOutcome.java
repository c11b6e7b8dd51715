package com.whereq.netpilot.dispatch;

import com.whereq.netpilot.model.DeviceResult;
import com.whereq.netpilot.model.JobStatus;
import com.whereq.netpilot.model.JobSummary;
import lombok.Value;

import java.util.List;

/**
 * Aggregated result of dispatching one job
 */
@Value
public class DispatchOutcome {
    List<DeviceResult> results;

    JobSummary summary;

    /**
     * Cancellation was observed while dispatching
     */
    boolean cancelled;

    public JobStatus deriveStatus() {
        return deriveStatus(summary, cancelled);
    }

    /**
     * Terminal job state from per-device counters.
     * Skipped devices count as not succeeded.
     */
    public static JobStatus deriveStatus(JobSummary summary, boolean cancelled) {
        if (cancelled) {
            return JobStatus.CANCELLED;
        }
        if (summary.getTotal() == 0) {
            return JobStatus.NO_TARGETS;
        }
        if (summary.getSucceeded() == 0) {
            return JobStatus.FAILED;
        }
        if (summary.getFailed() + summary.getSkipped() == 0) {
            return JobStatus.SUCCESS;
        }
        return JobStatus.PARTIAL_FAILURE;
    }
}
