package com.tracking.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracking.engine.dto.GeofenceRegion;
import org.springframework.boot.autoconfigure.cache.RedisCacheManagerBuilderCustomizer;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;

/**
 * Cache setup for geofence definition lookups.
 *
 * With {@code spring.cache.type=redis} the definitions are stored as typed
 * JSON in Redis. Any other cache type (tests use {@code simple}) ignores the
 * customizer below.
 */
@Configuration
@EnableCaching
public class CacheConfig {

    public static final String GEOFENCE_CACHE = "geofence-definitions";

    @Bean
    public RedisCacheManagerBuilderCustomizer geofenceCacheCustomizer(ObjectMapper objectMapper,
                                                                       TrackingProperties properties) {
        RedisCacheConfiguration geofenceCache = RedisCacheConfiguration.defaultCacheConfig()
            .entryTtl(Duration.ofMinutes(properties.getCache().getTtlMinutes()))
            .disableCachingNullValues()
            .serializeKeysWith(
                RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer())
            )
            .serializeValuesWith(
                RedisSerializationContext.SerializationPair.fromSerializer(
                    new Jackson2JsonRedisSerializer<>(objectMapper, GeofenceRegion.class)
                )
            );

        return builder -> builder.withCacheConfiguration(GEOFENCE_CACHE, geofenceCache);
    }
}
