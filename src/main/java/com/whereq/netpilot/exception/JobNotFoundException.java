package com.whereq.netpilot.exception;

/**
 * Thrown when a job does not exist or is not visible to the caller's tenant
 */
public class JobNotFoundException extends RuntimeException {
    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
    }
}
