package com.whereq.netpilot.exception;

/**
 * Thrown when a job store write still fails after all retries
 */
public class PersistenceFailureException extends RuntimeException {
    public PersistenceFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
