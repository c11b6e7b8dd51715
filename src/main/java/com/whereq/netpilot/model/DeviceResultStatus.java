package com.whereq.netpilot.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of one device within one job
 */
public enum DeviceResultStatus {
    SUCCESS,
    FAILED,
    SKIPPED;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static DeviceResultStatus fromWireName(String value) {
        return DeviceResultStatus.valueOf(value.toUpperCase());
    }
}
