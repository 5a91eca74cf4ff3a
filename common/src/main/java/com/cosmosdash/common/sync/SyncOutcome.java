package com.cosmosdash.common.sync;

/**
 * How one synchronization invocation ended. Fetch failures are not an
 * outcome; they are thrown.
 */
public enum SyncOutcome {
    /** Fetch lock was held, no upstream call made. */
    SKIPPED_LOCKED,
    /** Fetched, persisted, cache refreshed, lock set. */
    SYNCED,
    /**
     * Fetched and cached, lock set, but the durable write failed. Data from
     * this fetch is lost until the lock expires and the next tick re-fetches.
     */
    SYNCED_PERSIST_FAILED
}
