package com.whereq.netpilot.broadcast;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.netpilot.config.NetPilotProperties;
import com.whereq.netpilot.model.JobEvent;
import com.whereq.netpilot.model.JobStatus;
import com.whereq.netpilot.store.JsonCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.connection.ReactiveSubscription;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Verifies channel naming and event encoding over Redis pub/sub.
 */
@DisplayName("RedisBroadcastChannel Tests")
class RedisBroadcastChannelTest {

    private ReactiveRedisTemplate<String, String> redis;
    private JsonCodec json;
    private RedisBroadcastChannel channel;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redis = mock(ReactiveRedisTemplate.class);
        json = new JsonCodec(new ObjectMapper().findAndRegisterModules());
        channel = new RedisBroadcastChannel(redis, json, new NetPilotProperties());
    }

    @Test
    @DisplayName("Should publish the event as JSON on the job channel")
    void testPublish() {
        ArgumentCaptor<String> message = ArgumentCaptor.forClass(String.class);
        when(redis.convertAndSend(eq("netpilot:job:job-1"), message.capture())).thenReturn(Mono.just(2L));

        StepVerifier.create(channel.publish("job-1", JobEvent.status("job-1", JobStatus.RUNNING)))
            .verifyComplete();

        JobEvent sent = json.read(message.getValue(), JobEvent.class);
        assertEquals(JobEvent.Type.STATUS, sent.getType());
        assertEquals(JobStatus.RUNNING, sent.getStatus());
    }

    @Test
    @DisplayName("Should decode events received on the job channel")
    void testSubscribe() {
        String payload = json.write(JobEvent.status("job-1", JobStatus.SUCCESS));
        doReturn(Flux.just(new ReactiveSubscription.ChannelMessage<>("netpilot:job:job-1", payload)))
            .when(redis).listenToChannel("netpilot:job:job-1");

        StepVerifier.create(channel.subscribe("job-1"))
            .assertNext(event -> {
                assertEquals("job-1", event.getJobId());
                assertEquals(JobStatus.SUCCESS, event.getStatus());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("Should fail the publish when Redis rejects the message")
    void testPublishFailure() {
        when(redis.convertAndSend(eq("netpilot:job:job-2"), anyString()))
            .thenReturn(Mono.error(new IllegalStateException("not connected")));

        StepVerifier.create(channel.publish("job-2", JobEvent.status("job-2", JobStatus.FAILED)))
            .expectError(IllegalStateException.class)
            .verify();
    }
}
