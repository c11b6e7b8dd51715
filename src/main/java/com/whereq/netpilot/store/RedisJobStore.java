package com.whereq.netpilot.store;

import com.whereq.netpilot.config.NetPilotProperties;
import com.whereq.netpilot.model.DeviceResult;
import com.whereq.netpilot.model.Job;
import com.whereq.netpilot.model.JobLogEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Job records in Redis. The job is a JSON string; logs and results are JSON lists.
 * Every key carries the configured store TTL.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "netpilot.store.type", havingValue = "redis", matchIfMissing = true)
public class RedisJobStore implements JobStore {

    private static final String JOB_KEY_PREFIX = "netpilot:job:";
    private static final String LOGS_SUFFIX = ":logs";
    private static final String RESULTS_SUFFIX = ":results";

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final JsonCodec json;
    private final Duration ttl;

    public RedisJobStore(ReactiveRedisTemplate<String, String> redisTemplate, JsonCodec json,
                         NetPilotProperties properties) {
        this.redisTemplate = redisTemplate;
        this.json = json;
        this.ttl = properties.getStore().getTtl();
    }

    @Override
    public Mono<Void> create(Job job) {
        return redisTemplate.opsForValue()
            .set(jobKey(job.getId()), json.write(job), ttl)
            .doOnSuccess(ok -> log.debug("Stored job {}", job.getId()))
            .then();
    }

    @Override
    public Mono<Void> setStatus(Job job) {
        String key = jobKey(job.getId());
        return redisTemplate.opsForValue()
            .set(key, json.write(job), ttl)
            .doOnSuccess(ok -> log.debug("Job {} status stored: {}", job.getId(), job.getStatus()))
            .then();
    }

    @Override
    public Mono<Void> appendLog(String jobId, JobLogEntry entry) {
        String key = jobKey(jobId) + LOGS_SUFFIX;
        return redisTemplate.opsForList()
            .rightPush(key, json.write(entry))
            .then(redisTemplate.expire(key, ttl))
            .then();
    }

    @Override
    public Mono<Void> appendResult(String jobId, DeviceResult result) {
        String key = jobKey(jobId) + RESULTS_SUFFIX;
        return redisTemplate.opsForList()
            .rightPush(key, json.write(result))
            .then(redisTemplate.expire(key, ttl))
            .then();
    }

    @Override
    public Mono<Job> get(String jobId) {
        return redisTemplate.opsForValue()
            .get(jobKey(jobId))
            .map(value -> json.read(value, Job.class));
    }

    @Override
    public Flux<JobLogEntry> logs(String jobId) {
        return redisTemplate.opsForList()
            .range(jobKey(jobId) + LOGS_SUFFIX, 0, -1)
            .map(value -> json.read(value, JobLogEntry.class));
    }

    @Override
    public Flux<DeviceResult> results(String jobId) {
        return redisTemplate.opsForList()
            .range(jobKey(jobId) + RESULTS_SUFFIX, 0, -1)
            .map(value -> json.read(value, DeviceResult.class));
    }

    private static String jobKey(String jobId) {
        return JOB_KEY_PREFIX + jobId;
    }
}
