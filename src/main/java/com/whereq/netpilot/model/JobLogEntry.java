package com.whereq.netpilot.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One line of a job's audit log
 */
@Value
@Builder
@Jacksonized
public class JobLogEntry {
    Instant timestamp;

    Level level;

    /**
     * Device hostname the entry refers to, null for job-level entries
     */
    String host;

    String message;

    public static JobLogEntry info(String host, String message) {
        return of(Level.INFO, host, message);
    }

    public static JobLogEntry warn(String host, String message) {
        return of(Level.WARN, host, message);
    }

    public static JobLogEntry error(String host, String message) {
        return of(Level.ERROR, host, message);
    }

    private static JobLogEntry of(Level level, String host, String message) {
        return JobLogEntry.builder()
            .timestamp(Instant.now())
            .level(level)
            .host(host)
            .message(message)
            .build();
    }

    public enum Level {
        INFO,
        WARN,
        ERROR
    }
}
