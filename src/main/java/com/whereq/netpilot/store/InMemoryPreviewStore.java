package com.whereq.netpilot.store;

import com.whereq.netpilot.model.PreviewRecord;
import lombok.Value;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local preview store. Expired records are dropped on read.
 */
@Service
@ConditionalOnProperty(name = "netpilot.store.type", havingValue = "memory")
public class InMemoryPreviewStore implements PreviewStore {

    private final Map<String, Entry> records = new ConcurrentHashMap<>();
    private final Clock clock;

    @Autowired
    public InMemoryPreviewStore() {
        this(Clock.systemUTC());
    }

    public InMemoryPreviewStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Mono<Void> save(PreviewRecord record, Duration retention) {
        return Mono.fromRunnable(() ->
            records.put(record.getPreviewJobId(), new Entry(record, clock.instant().plus(retention))));
    }

    @Override
    public Mono<PreviewRecord> find(String previewJobId) {
        return Mono.fromSupplier(() -> {
            Entry entry = records.get(previewJobId);
            if (entry == null) {
                return null;
            }
            if (!clock.instant().isBefore(entry.getExpiresAt())) {
                records.remove(previewJobId, entry);
                return null;
            }
            return entry.getRecord();
        });
    }

    @Value
    private static class Entry {
        PreviewRecord record;
        Instant expiresAt;
    }
}
