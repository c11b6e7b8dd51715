package com.whereq.netpilot.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Job lifecycle states
 *
 * State transitions:
 * QUEUED → RUNNING → {SUCCESS, PARTIAL_FAILURE, FAILED}
 * QUEUED → NO_TARGETS
 * QUEUED, RUNNING → CANCELLED
 */
public enum JobStatus {
    /**
     * Accepted, not yet dispatched
     */
    QUEUED("queued"),

    /**
     * Per-device execution in progress
     */
    RUNNING("running"),

    /**
     * Every target succeeded
     */
    SUCCESS("success"),

    /**
     * At least one target succeeded and at least one did not
     */
    PARTIAL_FAILURE("partial_failure"),

    /**
     * No target succeeded
     */
    FAILED("failed"),

    /**
     * Target resolution produced an empty set
     */
    NO_TARGETS("no_targets"),

    /**
     * Operator-initiated cancellation
     */
    CANCELLED("cancelled");

    private final String wireName;

    JobStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static JobStatus fromWireName(String value) {
        for (JobStatus status : values()) {
            if (status.wireName.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown job status: " + value);
    }

    /**
     * Check if this is a terminal state
     */
    public boolean isTerminal() {
        return this != QUEUED && this != RUNNING;
    }

    /**
     * Check if job is waiting or executing
     */
    public boolean isActive() {
        return this == QUEUED || this == RUNNING;
    }

    /**
     * Check if a completed preview in this state may be committed
     */
    public boolean isCommittable() {
        return this == SUCCESS || this == PARTIAL_FAILURE;
    }

    /**
     * Check whether the state machine allows moving to {@code next}
     */
    public boolean canTransitionTo(JobStatus next) {
        return allowedTransitions().contains(next);
    }

    private Set<JobStatus> allowedTransitions() {
        return switch (this) {
            case QUEUED -> EnumSet.of(RUNNING, NO_TARGETS, FAILED, CANCELLED);
            case RUNNING -> EnumSet.of(SUCCESS, PARTIAL_FAILURE, FAILED, CANCELLED);
            default -> EnumSet.noneOf(JobStatus.class);
        };
    }
}
