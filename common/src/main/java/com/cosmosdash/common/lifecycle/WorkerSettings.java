package com.cosmosdash.common.lifecycle;

import java.time.Duration;

/**
 * Timing for one periodic worker.
 *
 * @param interval          wait between the end of one tick and the start of the next
 * @param runOnStart        invoke once immediately instead of waiting for the first interval
 * @param invocationTimeout deadline for a single invocation, independent of the interval
 */
public record WorkerSettings(Duration interval, boolean runOnStart, Duration invocationTimeout) {

    public WorkerSettings {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Worker interval must be positive, got " + interval);
        }
        if (invocationTimeout == null || invocationTimeout.isZero() || invocationTimeout.isNegative()) {
            throw new IllegalArgumentException("Invocation timeout must be positive, got " + invocationTimeout);
        }
    }
}
