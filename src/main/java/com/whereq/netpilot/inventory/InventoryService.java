package com.whereq.netpilot.inventory;

import com.whereq.netpilot.model.DeviceRecord;
import com.whereq.netpilot.model.TargetSpec;
import reactor.core.publisher.Flux;

import java.util.Collection;

/**
 * Device inventory consumed by the target resolver
 */
public interface InventoryService {
    /**
     * Devices of the given tenant matching the filter criteria of {@code spec}
     *
     * @param spec target specification
     * @param tenantId tenant scope
     * @return Flux of matching device records
     */
    Flux<DeviceRecord> lookup(TargetSpec spec, String tenantId);

    /**
     * Devices with the given identifiers regardless of tenant; unknown ids are simply absent
     *
     * @param deviceIds device identifiers
     * @return Flux of found device records
     */
    Flux<DeviceRecord> findByIds(Collection<Long> deviceIds);
}
