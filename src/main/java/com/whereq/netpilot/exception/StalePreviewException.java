package com.whereq.netpilot.exception;

/**
 * Thrown when a commit cannot be proven to apply exactly what was previewed
 */
public class StalePreviewException extends RuntimeException {
    public StalePreviewException(String message) {
        super(message);
    }
}
