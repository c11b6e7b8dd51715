package com.whereq.netpilot.dispatch;

import com.whereq.netpilot.executor.WorkUnit;
import com.whereq.netpilot.model.DeviceTarget;
import lombok.Value;

/**
 * One device slot in a dispatch plan: either work to run or a reason the device is skipped
 */
@Value
public class DispatchItem {
    DeviceTarget target;

    WorkUnit unit;

    String skipReason;

    public static DispatchItem run(DeviceTarget target, WorkUnit unit) {
        return new DispatchItem(target, unit, null);
    }

    public static DispatchItem skip(DeviceTarget target, String reason) {
        return new DispatchItem(target, null, reason);
    }

    public boolean isSkipped() {
        return unit == null;
    }
}
