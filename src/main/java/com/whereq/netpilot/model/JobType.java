package com.whereq.netpilot.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of automation work a job can carry
 */
public enum JobType {
    /**
     * Run a batch of CLI commands against every target
     */
    RUN_COMMANDS("run_commands"),

    /**
     * Fetch and snapshot the running configuration
     */
    BACKUP("backup"),

    /**
     * Compute candidate vs running diff without applying it
     */
    DEPLOY_PREVIEW("deploy_preview"),

    /**
     * Apply a previously previewed configuration change
     */
    DEPLOY_COMMIT("deploy_commit");

    private final String wireName;

    JobType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static JobType fromWireName(String value) {
        for (JobType type : values()) {
            if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown job type: " + value);
    }
}
