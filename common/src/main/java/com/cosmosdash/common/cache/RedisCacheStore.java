package com.cosmosdash.common.cache;

import com.cosmosdash.common.exception.CacheUnavailableException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Redis-backed {@link CacheStore}.
 */
@Slf4j
public class RedisCacheStore extends AbstractCacheStore {

    private final StringRedisTemplate redis;

    public RedisCacheStore(StringRedisTemplate redis, ObjectMapper json) {
        super(json);
        this.redis = redis;
    }

    @Override
    public Optional<String> get(String key) {
        return execute("get", key, () -> Optional.ofNullable(redis.opsForValue().get(key)));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        Duration expiry = CacheStore.requirePositive(ttl);
        execute("set", key, () -> {
            redis.opsForValue().set(key, value, expiry);
            return null;
        });
    }

    @Override
    public boolean delete(String key) {
        return execute("delete", key, () -> Boolean.TRUE.equals(redis.delete(key)));
    }

    @Override
    public long deleteByPrefix(String prefix) {
        Set<String> matching = keys(prefix + "*");
        if (matching.isEmpty()) {
            return 0;
        }
        Long removed = execute("delete", prefix + "*", () -> redis.delete(matching));
        log.debug("Evicted {} keys under {}", removed, prefix);
        return removed == null ? 0 : removed;
    }

    @Override
    public boolean exists(String key) {
        return execute("exists", key, () -> Boolean.TRUE.equals(redis.hasKey(key)));
    }

    @Override
    public long increment(String key) {
        Long value = execute("increment", key, () -> redis.opsForValue().increment(key));
        return value == null ? 0 : value;
    }

    @Override
    public Set<String> keys(String pattern) {
        Set<String> found = execute("keys", pattern, () -> redis.keys(pattern));
        return found == null ? Set.of() : found;
    }

    private <T> T execute(String operation, String key, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new CacheUnavailableException(operation, key, e);
        }
    }
}
