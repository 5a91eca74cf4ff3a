package com.cosmosdash.ingestor.model;

import java.time.Duration;

/**
 * Feed-style upstreams whose whole response is kept as one snapshot.
 */
public enum FeedSource {
    APOD("apod", Duration.ofHours(24)),
    NEO("neo", Duration.ofHours(2));

    private final String code;
    private final Duration cacheTtl;

    FeedSource(String code, Duration cacheTtl) {
        this.code = code;
        this.cacheTtl = cacheTtl;
    }

    public String code() {
        return code;
    }

    public Duration cacheTtl() {
        return cacheTtl;
    }

    public String domain() {
        return "feed:" + code;
    }

    public static FeedSource fromCode(String code) {
        for (FeedSource source : values()) {
            if (source.code.equalsIgnoreCase(code)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown feed source: " + code);
    }
}
