package com.whereq.netpilot.resolver;

import com.whereq.netpilot.exception.InvalidTargetException;
import com.whereq.netpilot.inventory.InventoryService;
import com.whereq.netpilot.model.DeviceRecord;
import com.whereq.netpilot.model.DeviceTarget;
import com.whereq.netpilot.model.TargetSpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Turns a target specification into a deduplicated device list ordered by device identifier.
 * Explicit identifiers outside the caller's tenant are rejected, never dropped.
 */
@Slf4j
@RequiredArgsConstructor
public class TargetResolver {

    private final InventoryService inventoryService;

    /**
     * Resolve a target specification for a tenant
     *
     * @param spec target specification
     * @param tenantId caller's tenant
     * @return Mono with targets sorted by device id; errors with {@link InvalidTargetException}
     */
    public Mono<List<DeviceTarget>> resolve(TargetSpec spec, String tenantId) {
        if (spec == null) {
            return Mono.error(new InvalidTargetException("A target specification is required"));
        }
        return spec.isExplicit() ? resolveExplicit(spec, tenantId) : resolveFiltered(spec, tenantId);
    }

    private Mono<List<DeviceTarget>> resolveExplicit(TargetSpec spec, String tenantId) {
        Set<Long> requested = new LinkedHashSet<>(spec.getDeviceIds());

        return inventoryService.findByIds(requested)
            .collectList()
            .flatMap(found -> {
                Set<Long> visible = new LinkedHashSet<>();
                for (DeviceRecord device : found) {
                    if (tenantId.equals(device.getTenantId())) {
                        visible.add(device.getId());
                    }
                }
                List<Long> rejected = new ArrayList<>();
                for (Long id : requested) {
                    if (!visible.contains(id)) {
                        rejected.add(id);
                    }
                }
                if (!rejected.isEmpty()) {
                    log.warn("Rejected target spec for tenant {}: devices {} are unknown or outside tenant scope",
                        tenantId, rejected);
                    return Mono.error(new InvalidTargetException(
                        "Devices not available to this tenant: " + rejected, rejected));
                }
                List<DeviceRecord> matching = found.stream()
                    .filter(device -> tenantId.equals(device.getTenantId()))
                    .filter(spec::matches)
                    .toList();
                return Mono.just(toTargets(matching));
            });
    }

    private Mono<List<DeviceTarget>> resolveFiltered(TargetSpec spec, String tenantId) {
        return inventoryService.lookup(spec, tenantId)
            .filter(device -> tenantId.equals(device.getTenantId()))
            .filter(spec::matches)
            .collectList()
            .map(this::toTargets);
    }

    private List<DeviceTarget> toTargets(List<DeviceRecord> devices) {
        Map<Long, DeviceTarget> byId = new TreeMap<>();
        for (DeviceRecord device : devices) {
            byId.putIfAbsent(device.getId(), DeviceTarget.from(device));
        }
        return new ArrayList<>(byId.values());
    }
}
