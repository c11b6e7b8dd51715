package com.whereq.netpilot.transport;

import com.whereq.netpilot.model.DeviceErrorKind;
import com.whereq.netpilot.model.DeviceTarget;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Fallback used when no device driver integration is deployed. Every call fails as a protocol error.
 */
@Slf4j
public class UnconfiguredDeviceTransport implements DeviceTransport {

    @Override
    public TransportResponse send(DeviceTarget target, TransportRequest request, Duration timeout)
            throws DeviceTransportException {
        log.warn("No device transport configured, refusing {} on {}", request.getOperation(), target.getHostname());
        throw new DeviceTransportException(DeviceErrorKind.PROTOCOL_ERROR, "No device transport configured");
    }
}
