package com.whereq.netpilot.inventory;

import com.whereq.netpilot.model.DeviceRecord;
import com.whereq.netpilot.model.TargetSpec;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Inventory held in memory, loaded from {@code netpilot.inventory.devices}
 */
@Slf4j
public class StaticInventoryService implements InventoryService {

    private final Map<Long, DeviceRecord> devices = new ConcurrentHashMap<>();

    public StaticInventoryService(List<DeviceRecord> initial) {
        devices.putAll(initial.stream().collect(Collectors.toMap(DeviceRecord::getId, Function.identity(), (a, b) -> b)));
        log.info("Static inventory loaded with {} devices", devices.size());
    }

    @Override
    public Flux<DeviceRecord> lookup(TargetSpec spec, String tenantId) {
        return Flux.fromIterable(devices.values())
            .filter(device -> tenantId.equals(device.getTenantId()))
            .filter(device -> !spec.isExplicit() || spec.getDeviceIds().contains(device.getId()))
            .filter(spec::matches);
    }

    @Override
    public Flux<DeviceRecord> findByIds(Collection<Long> deviceIds) {
        return Flux.fromIterable(deviceIds)
            .distinct()
            .mapNotNull(devices::get);
    }

    public void put(DeviceRecord device) {
        devices.put(device.getId(), device);
    }

    public void remove(long deviceId) {
        devices.remove(deviceId);
    }
}
