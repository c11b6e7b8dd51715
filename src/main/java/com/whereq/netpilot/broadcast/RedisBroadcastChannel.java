package com.whereq.netpilot.broadcast;

import com.whereq.netpilot.config.NetPilotProperties;
import com.whereq.netpilot.model.JobEvent;
import com.whereq.netpilot.store.JsonCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Redis pub/sub, one channel per job
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "netpilot.store.type", havingValue = "redis", matchIfMissing = true)
public class RedisBroadcastChannel implements BroadcastChannel {

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final JsonCodec json;
    private final String channelPrefix;

    public RedisBroadcastChannel(ReactiveRedisTemplate<String, String> redisTemplate, JsonCodec json,
                                 NetPilotProperties properties) {
        this.redisTemplate = redisTemplate;
        this.json = json;
        this.channelPrefix = properties.getBroadcast().getChannelPrefix();
    }

    @Override
    public Mono<Void> publish(String jobId, JobEvent event) {
        return Mono.fromCallable(() -> json.write(event))
            .flatMap(message -> redisTemplate.convertAndSend(channel(jobId), message))
            .doOnNext(receivers -> log.trace("Published {} event for job {} to {} subscribers",
                event.getType(), jobId, receivers))
            .then();
    }

    @Override
    public Flux<JobEvent> subscribe(String jobId) {
        return redisTemplate.listenToChannel(channel(jobId))
            .map(message -> json.read(message.getMessage(), JobEvent.class));
    }

    private String channel(String jobId) {
        return channelPrefix + ":" + jobId;
    }
}
