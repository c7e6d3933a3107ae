package com.whereq.forge.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis configuration for the job store and job queues
 */
@Configuration
public class RedisConfig {

    /**
     * String template shared by the job store and the job queues. Keys, hash fields and
     * values are all plain strings so the Lua scripts can read and compare them.
     *
     * Marked {@code @Primary} because Spring Boot also registers a
     * {@code reactiveStringRedisTemplate} of the same generic type; without it every
     * {@code ReactiveRedisTemplate<String, String>} injection point would be ambiguous.
     */
    @Bean
    @Primary
    public ReactiveRedisTemplate<String, String> reactiveRedisTemplate(
            ReactiveRedisConnectionFactory connectionFactory) {

        RedisSerializationContext<String, String> serializationContext =
            RedisSerializationContext.<String, String>newSerializationContext(new StringRedisSerializer())
                .hashKey(new StringRedisSerializer())
                .hashValue(new StringRedisSerializer())
                .build();

        return new ReactiveRedisTemplate<>(connectionFactory, serializationContext);
    }
}
