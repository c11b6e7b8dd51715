package com.whereq.netpilot.dispatch;

import com.whereq.netpilot.model.DeviceResult;
import com.whereq.netpilot.model.JobProgress;
import com.whereq.netpilot.model.JobSummary;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects per-device results of one job. Workers append concurrently; each device owns one slot.
 */
public class ResultAccumulator {

    private final int total;
    private final Map<Long, DeviceResult> results = new LinkedHashMap<>();
    private int succeeded;
    private int failed;
    private int skipped;

    public ResultAccumulator(int total) {
        this.total = total;
    }

    /**
     * Record a device result and return the progress snapshot including it
     *
     * @throws IllegalStateException if the device already reported
     */
    public synchronized JobProgress add(DeviceResult result) {
        if (results.putIfAbsent(result.getDeviceId(), result) != null) {
            throw new IllegalStateException("Duplicate result for device " + result.getDeviceId());
        }
        switch (result.getStatus()) {
            case SUCCESS -> succeeded++;
            case FAILED -> failed++;
            case SKIPPED -> skipped++;
        }
        return snapshot();
    }

    public synchronized boolean contains(long deviceId) {
        return results.containsKey(deviceId);
    }

    public synchronized JobProgress snapshot() {
        return JobProgress.builder()
            .total(total)
            .completed(results.size())
            .succeeded(succeeded)
            .failed(failed)
            .skipped(skipped)
            .build();
    }

    public synchronized JobSummary summary() {
        return JobSummary.builder()
            .total(total)
            .succeeded(succeeded)
            .failed(failed)
            .skipped(skipped)
            .build();
    }

    /**
     * Results ordered by device identifier
     */
    public synchronized List<DeviceResult> results() {
        List<DeviceResult> ordered = new ArrayList<>(results.values());
        ordered.sort(Comparator.comparingLong(DeviceResult::getDeviceId));
        return ordered;
    }
}
