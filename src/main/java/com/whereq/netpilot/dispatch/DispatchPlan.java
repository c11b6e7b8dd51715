package com.whereq.netpilot.dispatch;

import com.whereq.netpilot.executor.WorkUnit;
import com.whereq.netpilot.model.DeviceTarget;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered per-device work for one job
 */
@Value
public class DispatchPlan {
    List<DispatchItem> items;

    public DispatchPlan(List<DispatchItem> items) {
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
    }

    /**
     * Same unit of work for every target
     */
    public static DispatchPlan uniform(List<DeviceTarget> targets, WorkUnit unit) {
        List<DispatchItem> items = new ArrayList<>(targets.size());
        for (DeviceTarget target : targets) {
            items.add(DispatchItem.run(target, unit));
        }
        return new DispatchPlan(items);
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
