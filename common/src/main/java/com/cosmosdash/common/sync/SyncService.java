package com.cosmosdash.common.sync;

/**
 * One synchronization domain: decides whether a fetch is due, and if so
 * pulls from the upstream source into the durable store and the cache.
 */
public interface SyncService {

    String domain();

    /**
     * Scheduled entry point. Honors the fetch lock.
     *
     * @throws com.cosmosdash.common.exception.FetchFailureException when the upstream call fails;
     *         the lock is left untouched so the next tick retries
     */
    SyncResult sync();

    /**
     * Manual entry point. Ignores the fetch lock and propagates every failure,
     * including persistence failures.
     */
    SyncResult forceSync();
}
