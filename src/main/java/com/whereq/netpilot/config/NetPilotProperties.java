package com.whereq.netpilot.config;

import com.whereq.netpilot.model.DeviceRecord;
import com.whereq.netpilot.model.RetryPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for WhereQ NetPilot.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "netpilot")
@Data
public class NetPilotProperties {

    private DispatchConfig dispatch = new DispatchConfig();

    private JobsConfig jobs = new JobsConfig();

    private QueueConfig queue = new QueueConfig();

    private StoreConfig store = new StoreConfig();

    private PreviewConfig preview = new PreviewConfig();

    private SafetyConfig safety = new SafetyConfig();

    private BroadcastConfig broadcast = new BroadcastConfig();

    private InventoryConfig inventory = new InventoryConfig();

    private WebhookConfig webhook = new WebhookConfig();

    @Data
    public static class DispatchConfig {
        /**
         * Maximum number of devices worked on concurrently within one job.
         */
        private int maxConcurrency = 10;

        /**
         * Per-device timeout used when a request does not specify one.
         */
        private Duration defaultTimeout = Duration.ofSeconds(30);

        /**
         * Largest per-device timeout a request may ask for.
         */
        private Duration maxTimeout = Duration.ofMinutes(10);
    }

    @Data
    public static class JobsConfig {
        /**
         * Jobs dispatched in parallel by the background processor.
         */
        private int maxConcurrentJobs = 4;
    }

    @Data
    public static class QueueConfig {
        /**
         * Queued jobs accepted before new submissions are rejected.
         */
        private long maxSize = 1000;

        /**
         * How often the Redis queue is polled.
         */
        private Duration pollInterval = Duration.ofSeconds(1);
    }

    @Data
    public static class StoreConfig {
        /**
         * Backend for queue, stores and broadcast.
         */
        private StoreType type = StoreType.REDIS;

        /**
         * Retention of job records, logs and results.
         */
        private Duration ttl = Duration.ofDays(7);

        /**
         * Retry policy for job store writes.
         */
        private RetryPolicy retry = RetryPolicy.defaultPolicy();
    }

    @Data
    public static class PreviewConfig {
        /**
         * How long preview records stay committable. Falls back to the store TTL when unset.
         */
        private Duration retention;

        /**
         * What a commit does with a previewed device that is no longer in inventory.
         */
        private MissingDevicePolicy missingDevicePolicy = MissingDevicePolicy.SKIP;
    }

    @Data
    public static class SafetyConfig {
        /**
         * Rules appended to the built-in dangerous command table.
         */
        private List<RuleDefinition> extraRules = new ArrayList<>();
    }

    @Data
    public static class RuleDefinition {
        private String name;
        private String category;
        private String pattern;
    }

    @Data
    public static class BroadcastConfig {
        /**
         * Redis pub/sub channel prefix; events go to {@code <prefix>:<jobId>}.
         */
        private String channelPrefix = "netpilot:job";
    }

    @Data
    public static class InventoryConfig {
        /**
         * Static device inventory used when no external inventory service is wired in.
         */
        private List<DeviceRecord> devices = new ArrayList<>();
    }

    @Data
    public static class WebhookConfig {
        private Duration connectTimeout = Duration.ofSeconds(5);

        /**
         * Overall time allowed for one notification.
         */
        private Duration timeout = Duration.ofSeconds(10);
    }

    public enum StoreType {
        /**
         * Reactive Redis for queue, job store, preview store and pub/sub.
         */
        REDIS,

        /**
         * Process-local maps and sinks. Nothing survives a restart.
         */
        MEMORY
    }

    public enum MissingDevicePolicy {
        /**
         * Record the vanished device as skipped and commit the rest.
         */
        SKIP,

        /**
         * Refuse the commit as stale.
         */
        REJECT
    }

    public Duration effectivePreviewRetention() {
        return preview.getRetention() != null ? preview.getRetention() : store.getTtl();
    }
}
