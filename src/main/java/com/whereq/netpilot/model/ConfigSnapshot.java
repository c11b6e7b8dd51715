package com.whereq.netpilot.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Stored running configuration of a device, written by backup jobs when the configuration changed
 */
@Value
@Builder
@Jacksonized
public class ConfigSnapshot {
    long deviceId;
    String jobId;
    String source;
    String hash;
    String configText;
    Instant createdAt;
}
