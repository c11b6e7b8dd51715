package com.whereq.netpilot.exception;

import java.util.Collection;
import java.util.List;

/**
 * Thrown when a target specification references devices outside the caller's tenant,
 * unknown devices, or devices that were never previewed
 */
public class InvalidTargetException extends RuntimeException {

    private final List<Long> deviceIds;

    public InvalidTargetException(String message) {
        this(message, List.of());
    }

    public InvalidTargetException(String message, Collection<Long> deviceIds) {
        super(message);
        this.deviceIds = List.copyOf(deviceIds);
    }

    public List<Long> getDeviceIds() {
        return deviceIds;
    }
}
