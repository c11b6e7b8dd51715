package com.whereq.netpilot.store;

import com.whereq.netpilot.model.ConfigSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Latest snapshot per device. Snapshots do not expire.
 */
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "netpilot.store.type", havingValue = "redis", matchIfMissing = true)
public class RedisConfigSnapshotStore implements ConfigSnapshotStore {

    private static final String SNAPSHOT_KEY_PREFIX = "netpilot:snapshot:";

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final JsonCodec json;

    @Override
    public Mono<ConfigSnapshot> latest(long deviceId) {
        return redisTemplate.opsForValue()
            .get(SNAPSHOT_KEY_PREFIX + deviceId)
            .map(value -> json.read(value, ConfigSnapshot.class));
    }

    @Override
    public Mono<Void> save(ConfigSnapshot snapshot) {
        return redisTemplate.opsForValue()
            .set(SNAPSHOT_KEY_PREFIX + snapshot.getDeviceId(), json.write(snapshot))
            .then();
    }
}
