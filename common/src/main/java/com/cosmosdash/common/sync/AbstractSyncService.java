package com.cosmosdash.common.sync;

import com.cosmosdash.common.cache.CacheAside;
import com.cosmosdash.common.cache.CacheStore;
import com.cosmosdash.common.cache.FetchLock;
import com.cosmosdash.common.exception.CacheUnavailableException;
import com.cosmosdash.common.exception.FetchFailureException;
import com.cosmosdash.common.exception.PersistFailureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Template for one synchronization domain.
 * <p>
 * Each invocation walks CHECK_LOCK, FETCH, TRANSFORM, PERSIST, REFRESH_CACHE
 * and SET_LOCK. A fetch or transform failure aborts before the lock is set so
 * the next tick retries. A persistence failure still refreshes the cache and
 * sets the lock, keeping a degraded store from being hammered every tick.
 *
 * @param <R> raw upstream document
 * @param <B> transformed batch handed to the repository
 */
@Slf4j
public abstract class AbstractSyncService<R, B> implements SyncService {

    private final String domain;
    private final FetchLock fetchLock;
    private final SyncMetrics metrics;

    protected final CacheAside cacheAside;
    protected final Clock clock;

    protected AbstractSyncService(String domain, CacheStore cache, Duration lockTtl, SyncMetrics metrics, Clock clock) {
        this.domain = domain;
        this.fetchLock = new FetchLock(cache, domain, lockTtl);
        this.cacheAside = new CacheAside(cache);
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Call the upstream source once.
     *
     * @throws FetchFailureException on any upstream failure
     */
    protected abstract R fetch();

    /**
     * Normalize the raw document. May throw {@link FetchFailureException} for
     * a body that does not match the declared shape.
     */
    protected abstract B transform(R raw, Instant fetchedAt);

    /**
     * Write the batch to the durable store.
     *
     * @return number of records written
     */
    protected abstract int persist(B batch);

    /**
     * Refresh cache entries derived from the new batch. Runs even when
     * {@link #persist} failed.
     */
    protected abstract void refreshCache(B batch);

    @Override
    public String domain() {
        return domain;
    }

    @Override
    public final SyncResult sync() {
        if (fetchLock.isHeld()) {
            log.debug("[{}] fetch lock {} held, skipping", domain, fetchLock.key());
            SyncResult skipped = SyncResult.skipped(domain);
            metrics.recordOutcome(skipped);
            return skipped;
        }
        return execute(false);
    }

    @Override
    public final SyncResult forceSync() {
        log.info("[{}] forced sync requested", domain);
        return execute(true);
    }

    public FetchLock fetchLock() {
        return fetchLock;
    }

    private SyncResult execute(boolean propagatePersistFailure) {
        Instant fetchedAt = clock.instant();
        long started = System.nanoTime();

        B batch;
        try {
            batch = transform(fetch(), fetchedAt);
        } catch (FetchFailureException e) {
            metrics.recordFetchFailure(domain);
            throw e;
        }

        int items = 0;
        PersistFailureException persistFailure = null;
        try {
            items = persist(batch);
        } catch (PersistFailureException e) {
            persistFailure = e;
        } catch (DataAccessException | TransactionException e) {
            // TransactionException: store unreachable before the first statement
            persistFailure = new PersistFailureException(domain, e);
        }
        if (persistFailure != null) {
            metrics.recordPersistFailure(domain);
            log.error("[{}] persist failed, fetched data from {} is not durable: {}",
                    domain, fetchedAt, persistFailure.getMessage());
        }

        try {
            refreshCache(batch);
        } catch (CacheUnavailableException e) {
            log.warn("[{}] cache refresh skipped: {}", domain, e.getMessage());
        }
        fetchLock.acquire(fetchedAt);

        SyncOutcome outcome = persistFailure == null ? SyncOutcome.SYNCED : SyncOutcome.SYNCED_PERSIST_FAILED;
        SyncResult result = new SyncResult(domain, outcome, items, fetchedAt,
                Duration.ofNanos(System.nanoTime() - started));
        metrics.recordOutcome(result);

        if (persistFailure != null && propagatePersistFailure) {
            throw persistFailure;
        }
        if (persistFailure == null) {
            log.info("[{}] synced {} item(s) in {} ms", domain, items, result.elapsed().toMillis());
        }
        return result;
    }
}
