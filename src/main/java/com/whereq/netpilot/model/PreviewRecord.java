package com.whereq.netpilot.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Diffs computed by a deploy_preview job, keyed by device. Read-only once written.
 */
@Value
@Builder
@Jacksonized
public class PreviewRecord {
    String previewJobId;

    String tenantId;

    TargetSpec targets;

    ConfigMode mode;

    String snippet;

    /**
     * Fingerprint of mode and snippet at preview time
     */
    String fingerprint;

    /**
     * Computed diff per device that previewed successfully
     */
    @Singular
    Map<Long, String> diffs;

    /**
     * Devices that could not compute a diff
     */
    @Singular
    Set<Long> failedDeviceIds;

    Instant createdAt;

    /**
     * Every device the preview covered, successful or not
     */
    public Set<Long> coveredDeviceIds() {
        Set<Long> ids = new HashSet<>(diffs.keySet());
        ids.addAll(failedDeviceIds);
        return ids;
    }

    public boolean hasReviewedDiff(long deviceId) {
        return diffs.containsKey(deviceId);
    }
}
