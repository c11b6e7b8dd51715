package com.whereq.netpilot.transport;

import com.whereq.netpilot.model.DeviceTarget;

import java.time.Duration;

/**
 * Uniform contract over the device driver library (connect, authenticate, send, receive).
 * Implementations block the calling thread for the duration of the device interaction.
 */
public interface DeviceTransport {
    /**
     * Perform one operation against one device
     *
     * @param target resolved device
     * @param request operation and payload
     * @param timeout budget for the whole interaction
     * @return raw device response
     * @throws DeviceTransportException if the device interaction fails
     */
    TransportResponse send(DeviceTarget target, TransportRequest request, Duration timeout)
        throws DeviceTransportException;
}
