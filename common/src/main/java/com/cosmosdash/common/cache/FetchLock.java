package com.cosmosdash.common.cache;

import com.cosmosdash.common.exception.CacheUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;

/**
 * Per-domain marker meaning "a fetch happened within the last TTL".
 * Never released explicitly; it expires.
 * <p>
 * Guards a single process only. When the cache is unreachable the lock reads
 * as not held, so the worker interval becomes the only throttle.
 */
@Slf4j
public class FetchLock {

    private final CacheStore cache;
    private final String key;
    private final Duration ttl;

    public FetchLock(CacheStore cache, String domain, Duration ttl) {
        this.cache = cache;
        this.key = keyFor(domain);
        this.ttl = CacheStore.requirePositive(ttl);
    }

    public static String keyFor(String domain) {
        return domain + ":last_fetch";
    }

    public boolean isHeld() {
        try {
            return cache.exists(key);
        } catch (CacheUnavailableException e) {
            log.warn("Fetch lock {} unreadable, treating as free: {}", key, e.getCause().getMessage());
            return false;
        }
    }

    public void acquire(Instant fetchedAt) {
        try {
            cache.set(key, fetchedAt.toString(), ttl);
        } catch (CacheUnavailableException e) {
            log.warn("Fetch lock {} not recorded: {}", key, e.getCause().getMessage());
        }
    }

    public String key() {
        return key;
    }

    public Duration ttl() {
        return ttl;
    }
}
