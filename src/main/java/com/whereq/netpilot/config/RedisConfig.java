package com.whereq.netpilot.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializationContext;

/**
 * Redis template shared by the job queue, the stores and pub/sub.
 * Values are JSON documents written as plain strings.
 */
@Configuration
@ConditionalOnProperty(name = "netpilot.store.type", havingValue = "redis", matchIfMissing = true)
public class RedisConfig {

    @Bean
    @Primary
    public ReactiveRedisTemplate<String, String> netpilotRedisTemplate(
            ReactiveRedisConnectionFactory connectionFactory) {
        return new ReactiveRedisTemplate<>(connectionFactory, RedisSerializationContext.string());
    }
}
