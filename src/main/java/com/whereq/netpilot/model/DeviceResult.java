package com.whereq.netpilot.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one device's execution within one job. Never mutated after creation.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeviceResult {
    long deviceId;

    String hostname;

    DeviceResultStatus status;

    /**
     * Command output, configuration text or diff
     */
    String output;

    DeviceErrorKind errorKind;

    String errorMessage;

    Instant startedAt;

    Instant finishedAt;

    @JsonIgnore
    public boolean isSuccess() {
        return status == DeviceResultStatus.SUCCESS;
    }

    public long getDurationMs() {
        if (startedAt == null || finishedAt == null) {
            return 0;
        }
        return Duration.between(startedAt, finishedAt).toMillis();
    }

    public static DeviceResult skipped(DeviceTarget target, String reason) {
        Instant now = Instant.now();
        return DeviceResult.builder()
            .deviceId(target.getDeviceId())
            .hostname(target.getHostname())
            .status(DeviceResultStatus.SKIPPED)
            .errorMessage(reason)
            .startedAt(now)
            .finishedAt(now)
            .build();
    }

    public static DeviceResult failed(DeviceTarget target, DeviceErrorKind kind, String message) {
        Instant now = Instant.now();
        return DeviceResult.builder()
            .deviceId(target.getDeviceId())
            .hostname(target.getHostname())
            .status(DeviceResultStatus.FAILED)
            .errorKind(kind)
            .errorMessage(message)
            .startedAt(now)
            .finishedAt(now)
            .build();
    }
}
