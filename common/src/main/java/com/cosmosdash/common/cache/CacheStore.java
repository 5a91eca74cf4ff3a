package com.cosmosdash.common.cache;

import com.fasterxml.jackson.core.type.TypeReference;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Key/value store with per-entry expiry, used as a disposable projection in
 * front of the durable repositories and as the home of fetch locks.
 * <p>
 * A missing key is an absent result, never an error. An unreachable store
 * surfaces as {@link com.cosmosdash.common.exception.CacheUnavailableException}.
 * Every write requires a strictly positive TTL; zero, negative or null TTLs
 * are rejected with {@link IllegalArgumentException}. Concurrent writers to the
 * same key are last-writer-wins.
 */
public interface CacheStore {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    /**
     * @return true when a value was removed
     */
    boolean delete(String key);

    /**
     * Delete every key starting with the given prefix.
     *
     * @return number of keys removed
     */
    long deleteByPrefix(String prefix);

    boolean exists(String key);

    /**
     * Atomically increment a counter, creating it at 1 when missing.
     */
    long increment(String key);

    /**
     * Read and deserialize a structured value. A value that no longer
     * deserializes is reported as absent.
     */
    <T> Optional<T> getJson(String key, Class<T> type);

    <T> Optional<T> getJson(String key, TypeReference<T> type);

    void setJson(String key, Object value, Duration ttl);

    Set<String> keys(String pattern);

    static Duration requirePositive(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("Cache TTL must be positive, got " + ttl);
        }
        return ttl;
    }
}
