package com.cosmosdash.common.sync;

import java.time.Duration;
import java.time.Instant;

public record SyncResult(
        String domain,
        SyncOutcome outcome,
        int items,
        Instant fetchedAt,
        Duration elapsed
) {

    public static SyncResult skipped(String domain) {
        return new SyncResult(domain, SyncOutcome.SKIPPED_LOCKED, 0, null, Duration.ZERO);
    }

    public boolean fetched() {
        return outcome != SyncOutcome.SKIPPED_LOCKED;
    }
}
