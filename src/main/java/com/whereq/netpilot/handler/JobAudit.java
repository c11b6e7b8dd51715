package com.whereq.netpilot.handler;

import com.whereq.netpilot.model.JobLogEntry;

/**
 * Append-only audit log of one job
 */
@FunctionalInterface
public interface JobAudit {

    /**
     * @throws IllegalStateException if the job is already terminal
     */
    void append(JobLogEntry entry);
}
