package com.whereq.netpilot.transport;

/**
 * Operations the device transport understands
 */
public enum TransportOperation {
    /**
     * Send CLI commands and collect their output
     */
    RUN_COMMANDS,

    /**
     * Retrieve the running configuration
     */
    GET_CONFIG,

    /**
     * Load a candidate configuration, diff it against running and discard it
     */
    COMPARE_CONFIG,

    /**
     * Load a candidate configuration and commit it
     */
    APPLY_CONFIG
}
