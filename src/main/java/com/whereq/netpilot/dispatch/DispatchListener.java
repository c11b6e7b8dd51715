package com.whereq.netpilot.dispatch;

import com.whereq.netpilot.model.DeviceResult;
import com.whereq.netpilot.model.DeviceTarget;
import com.whereq.netpilot.model.JobProgress;

/**
 * Callbacks from a running dispatch. {@link #onResult} calls are serialized, and progress
 * snapshots arrive in non-decreasing order of completed devices.
 */
public interface DispatchListener {

    DispatchListener NONE = new DispatchListener() {
        @Override
        public void onResult(DeviceResult result, JobProgress progress) {
        }
    };

    /**
     * A worker is about to contact the device. May be called from several workers at once.
     */
    default void onStart(DeviceTarget target) {
    }

    /**
     * A device result was accumulated
     */
    void onResult(DeviceResult result, JobProgress progress);
}
