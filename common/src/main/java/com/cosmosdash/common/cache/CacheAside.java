package com.cosmosdash.common.cache;

import com.cosmosdash.common.exception.CacheUnavailableException;
import com.cosmosdash.common.exception.ServiceDegradedException;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Read-through and write-through helpers over a {@link CacheStore}.
 * <p>
 * Reads: a cache failure counts as a miss, a miss falls through to the
 * loader (always the durable store, never a live upstream call), and a
 * non-empty loaded value is written back with the given TTL. Writes: cache
 * failures are logged and swallowed.
 */
@Slf4j
public class CacheAside {

    private final CacheStore cache;

    public CacheAside(CacheStore cache) {
        this.cache = cache;
    }

    public <T> Optional<T> read(String key, TypeReference<T> type) {
        try {
            return cache.getJson(key, type).filter(CacheAside::isNonEmpty);
        } catch (CacheUnavailableException e) {
            log.warn("Cache read failed for {}, falling back to store: {}", key, e.getCause().getMessage());
            return Optional.empty();
        }
    }

    public void write(String key, Object value, Duration ttl) {
        try {
            cache.setJson(key, value, ttl);
        } catch (CacheUnavailableException e) {
            log.warn("Cache write skipped for {}: {}", key, e.getCause().getMessage());
        }
    }

    public void evict(String key) {
        try {
            cache.delete(key);
        } catch (CacheUnavailableException e) {
            log.warn("Cache eviction skipped for {}: {}", key, e.getCause().getMessage());
        }
    }

    public void evictPrefix(String prefix) {
        try {
            cache.deleteByPrefix(prefix);
        } catch (CacheUnavailableException e) {
            log.warn("Cache eviction skipped for {}*: {}", prefix, e.getCause().getMessage());
        }
    }

    /**
     * Cache first, then the durable store.
     *
     * @throws ServiceDegradedException when the durable store cannot be read
     */
    public <T> Optional<T> readThrough(String domain, String key, TypeReference<T> type, Duration ttl,
                                       Supplier<Optional<T>> loader) {
        Optional<T> cached = read(key, type);
        if (cached.isPresent()) {
            return cached;
        }
        Optional<T> loaded = load(domain, loader);
        loaded.filter(CacheAside::isNonEmpty).ifPresent(value -> write(key, value, ttl));
        return loaded;
    }

    /**
     * List flavour of {@link #readThrough}. Empty lists are returned but never cached.
     */
    public <T> List<T> readThroughList(String domain, String key, TypeReference<List<T>> type, Duration ttl,
                                       Supplier<List<T>> loader) {
        return readThrough(domain, key, type, ttl, () -> Optional.of(loader.get()))
                .orElse(List.of());
    }

    private static <T> Optional<T> load(String domain, Supplier<Optional<T>> loader) {
        try {
            return loader.get();
        } catch (DataAccessException e) {
            throw new ServiceDegradedException(domain, e);
        }
    }

    private static boolean isNonEmpty(Object value) {
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        if (value instanceof CharSequence text) {
            return !text.toString().isBlank();
        }
        return value != null;
    }
}
