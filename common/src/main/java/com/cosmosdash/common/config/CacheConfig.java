package com.cosmosdash.common.config;

import com.cosmosdash.common.cache.CacheStore;
import com.cosmosdash.common.cache.RedisCacheStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Exposes the Redis-backed {@link CacheStore}.
 */
@Configuration
public class CacheConfig {

    @Bean
    public CacheStore cacheStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        return new RedisCacheStore(redisTemplate, objectMapper);
    }
}
