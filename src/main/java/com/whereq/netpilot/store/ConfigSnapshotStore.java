package com.whereq.netpilot.store;

import com.whereq.netpilot.model.ConfigSnapshot;
import reactor.core.publisher.Mono;

/**
 * Latest backed-up configuration per device
 */
public interface ConfigSnapshotStore {

    Mono<ConfigSnapshot> latest(long deviceId);

    Mono<Void> save(ConfigSnapshot snapshot);
}
