package com.whereq.netpilot.queue;

import com.whereq.netpilot.config.NetPilotProperties;
import com.whereq.netpilot.model.QueuedJob;
import com.whereq.netpilot.store.JsonCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Redis list based job queue. Producers push right, the processor polls left.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "netpilot.store.type", havingValue = "redis", matchIfMissing = true)
public class RedisJobQueue implements JobQueue {

    private static final String QUEUE_KEY = "netpilot:jobs:queue";

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final JsonCodec json;
    private final Duration pollInterval;

    private final ConcurrentHashMap<String, QueuedJob> processingJobs = new ConcurrentHashMap<>();

    public RedisJobQueue(ReactiveRedisTemplate<String, String> redisTemplate, JsonCodec json,
                         NetPilotProperties properties) {
        this.redisTemplate = redisTemplate;
        this.json = json;
        this.pollInterval = properties.getQueue().getPollInterval();
    }

    @Override
    public Mono<Void> enqueue(QueuedJob job) {
        return Mono.fromCallable(() -> json.write(job))
            .flatMap(payload -> redisTemplate.opsForList().rightPush(QUEUE_KEY, payload))
            .doOnSuccess(size -> log.info("Enqueued {} job {}, {} waiting", job.getType(), job.getJobId(), size))
            .then();
    }

    @Override
    public Flux<QueuedJob> consume() {
        return Flux.interval(pollInterval)
            .onBackpressureDrop()
            .concatMap(tick -> drain())
            .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Pop every job currently waiting
     */
    private Flux<QueuedJob> drain() {
        return redisTemplate.opsForList().leftPop(QUEUE_KEY)
            .expand(previous -> redisTemplate.opsForList().leftPop(QUEUE_KEY))
            .onErrorResume(e -> {
                log.warn("Queue poll failed: {}", e.getMessage());
                return Flux.empty();
            })
            .flatMap(payload -> {
                try {
                    QueuedJob job = json.read(payload, QueuedJob.class);
                    processingJobs.put(job.getJobId(), job);
                    log.debug("Consumed job {} from queue", job.getJobId());
                    return Mono.just(job);
                } catch (IllegalStateException e) {
                    log.error("Dropping unreadable queue entry", e);
                    return Mono.empty();
                }
            });
    }

    @Override
    public Mono<Void> acknowledge(String jobId) {
        return Mono.fromRunnable(() -> {
            QueuedJob removed = processingJobs.remove(jobId);
            if (removed != null) {
                log.debug("Acknowledged job {}", jobId);
            }
        }).then();
    }

    /**
     * Looks the entry up in the list itself, so any instance can withdraw a job another one enqueued.
     * LREM removes nothing if a consumer popped the entry in between.
     */
    @Override
    public Mono<Boolean> withdraw(String jobId) {
        return redisTemplate.opsForList().range(QUEUE_KEY, 0, -1)
            .filter(payload -> jobId.equals(jobIdOf(payload)))
            .next()
            .flatMap(payload -> redisTemplate.opsForList().remove(QUEUE_KEY, 1, payload))
            .map(removed -> removed > 0)
            .defaultIfEmpty(false)
            .doOnSuccess(removed -> {
                if (Boolean.TRUE.equals(removed)) {
                    log.info("Withdrew job {} from queue", jobId);
                }
            });
    }

    private String jobIdOf(String payload) {
        try {
            return json.read(payload, QueuedJob.class).getJobId();
        } catch (IllegalStateException e) {
            return null;
        }
    }

    @Override
    public Mono<Long> depth() {
        return redisTemplate.opsForList().size(QUEUE_KEY)
            .defaultIfEmpty(0L);
    }
}
