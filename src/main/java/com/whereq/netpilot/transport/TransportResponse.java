package com.whereq.netpilot.transport;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Raw result returned by the device transport
 */
@Value
@Builder
public class TransportResponse {
    /**
     * Configuration text, diff, or commit acknowledgement
     */
    String output;

    /**
     * Output per command for RUN_COMMANDS, in command order
     */
    @Singular
    Map<String, String> commandOutputs;
}
