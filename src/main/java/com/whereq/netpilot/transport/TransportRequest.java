package com.whereq.netpilot.transport;

import com.whereq.netpilot.model.ConfigMode;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Payload handed to the device transport
 */
@Value
@Builder
public class TransportRequest {
    TransportOperation operation;

    List<String> commands;

    String snippet;

    ConfigMode mode;
}
