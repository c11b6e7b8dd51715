package com.whereq.netpilot.store;

import com.whereq.netpilot.model.PreviewRecord;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Holds preview diffs between a deploy_preview job and the commit that references it
 */
public interface PreviewStore {
    /**
     * Store a preview record, retrievable until {@code retention} elapses
     */
    Mono<Void> save(PreviewRecord record, Duration retention);

    /**
     * @return the record, or empty if it never existed or has expired
     */
    Mono<PreviewRecord> find(String previewJobId);
}
