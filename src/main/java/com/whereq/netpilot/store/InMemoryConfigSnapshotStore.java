package com.whereq.netpilot.store;

import com.whereq.netpilot.model.ConfigSnapshot;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local snapshot store
 */
@Service
@ConditionalOnProperty(name = "netpilot.store.type", havingValue = "memory")
public class InMemoryConfigSnapshotStore implements ConfigSnapshotStore {

    private final Map<Long, ConfigSnapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public Mono<ConfigSnapshot> latest(long deviceId) {
        return Mono.justOrEmpty(snapshots.get(deviceId));
    }

    @Override
    public Mono<Void> save(ConfigSnapshot snapshot) {
        return Mono.fromRunnable(() -> snapshots.put(snapshot.getDeviceId(), snapshot));
    }
}
