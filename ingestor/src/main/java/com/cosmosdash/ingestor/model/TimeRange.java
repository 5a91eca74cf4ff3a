package com.cosmosdash.ingestor.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Inclusive query window.
 */
public record TimeRange(Instant from, Instant to) {

    public TimeRange {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("Range start " + from + " is after end " + to);
        }
    }

    /**
     * Fill in open ends, put reversed bounds back in order and cap the width.
     *
     * @param from          null means {@code to - defaultWidth}
     * @param to            null means {@code now}
     * @param defaultWidth  width used for an open start
     * @param maxWidth      wider ranges keep their end and move their start forward
     */
    public static TimeRange resolve(Instant from, Instant to, Instant now, Duration defaultWidth, Duration maxWidth) {
        Instant end = to != null ? to : now;
        Instant start = from != null ? from : end.minus(defaultWidth);
        if (start.isAfter(end)) {
            Instant swap = start;
            start = end;
            end = swap;
        }
        if (Duration.between(start, end).compareTo(maxWidth) > 0) {
            start = end.minus(maxWidth);
        }
        return new TimeRange(start, end);
    }

    public Duration width() {
        return Duration.between(from, to);
    }
}
