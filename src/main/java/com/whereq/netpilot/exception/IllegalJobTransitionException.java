package com.whereq.netpilot.exception;

import com.whereq.netpilot.model.JobStatus;

/**
 * Thrown when a state change violates the job state machine, including any change to a terminal job
 */
public class IllegalJobTransitionException extends IllegalStateException {

    private final JobStatus from;
    private final JobStatus to;

    public IllegalJobTransitionException(String jobId, JobStatus from, JobStatus to) {
        super("Job " + jobId + " cannot move from " + from.getWireName() + " to " + to.getWireName());
        this.from = from;
        this.to = to;
    }

    public JobStatus getFrom() {
        return from;
    }

    public JobStatus getTo() {
        return to;
    }
}
