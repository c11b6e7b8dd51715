package com.whereq.netpilot.store;

import com.whereq.netpilot.model.PreviewRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Preview records as JSON strings; Redis expiry implements the retention policy
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "netpilot.store.type", havingValue = "redis", matchIfMissing = true)
public class RedisPreviewStore implements PreviewStore {

    private static final String PREVIEW_KEY_PREFIX = "netpilot:preview:";

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final JsonCodec json;

    @Override
    public Mono<Void> save(PreviewRecord record, Duration retention) {
        return redisTemplate.opsForValue()
            .set(PREVIEW_KEY_PREFIX + record.getPreviewJobId(), json.write(record), retention)
            .doOnSuccess(ok -> log.info("Stored preview {} for {} devices, retained {}",
                record.getPreviewJobId(), record.coveredDeviceIds().size(), retention))
            .then();
    }

    @Override
    public Mono<PreviewRecord> find(String previewJobId) {
        return redisTemplate.opsForValue()
            .get(PREVIEW_KEY_PREFIX + previewJobId)
            .map(value -> json.read(value, PreviewRecord.class));
    }
}
