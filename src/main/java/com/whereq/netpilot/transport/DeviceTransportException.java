package com.whereq.netpilot.transport;

import com.whereq.netpilot.model.DeviceErrorKind;

/**
 * Failure reported by a device transport, with its classification
 */
public class DeviceTransportException extends Exception {

    private final DeviceErrorKind kind;

    public DeviceTransportException(DeviceErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DeviceTransportException(DeviceErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public DeviceErrorKind getKind() {
        return kind;
    }
}
