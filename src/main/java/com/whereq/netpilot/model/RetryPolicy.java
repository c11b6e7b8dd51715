package com.whereq.netpilot.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Duration;

/**
 * Retry policy for job store writes. Bound from {@code netpilot.store.retry}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryPolicy {

    /**
     * Attempts after the first failure
     */
    @Builder.Default
    private int maxRetries = 3;

    @Builder.Default
    private long initialIntervalMs = 200;

    @Builder.Default
    private long maxIntervalMs = 5000;

    public static RetryPolicy defaultPolicy() {
        return RetryPolicy.builder().build();
    }

    /**
     * Exponential backoff, doubling per attempt up to the max interval.
     * Encoding failures are not retried: the same record fails the same way.
     */
    public RetryBackoffSpec toRetrySpec() {
        return Retry.backoff(maxRetries, Duration.ofMillis(initialIntervalMs))
            .maxBackoff(Duration.ofMillis(maxIntervalMs))
            .jitter(0.0)
            .filter(RetryPolicy::isTransient);
    }

    static boolean isTransient(Throwable error) {
        return !(error.getCause() instanceof JsonProcessingException);
    }
}
