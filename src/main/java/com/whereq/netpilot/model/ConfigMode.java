package com.whereq.netpilot.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a configuration snippet is combined with the running configuration
 */
public enum ConfigMode {
    /**
     * Merge the snippet into the running configuration
     */
    MERGE,

    /**
     * Replace the running configuration with the snippet
     */
    REPLACE;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ConfigMode fromWireName(String value) {
        for (ConfigMode mode : values()) {
            if (mode.name().equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported config mode: " + value);
    }
}
