package com.whereq.netpilot.exception;

/**
 * Exception thrown when job queue is full
 */
public class QuotaExceededException extends RuntimeException {
    public QuotaExceededException(String message) {
        super(message);
    }
}
