package com.cosmosdash.ingestor.service;

import com.cosmosdash.common.cache.CacheStore;
import com.cosmosdash.common.exception.FetchFailureException;
import com.cosmosdash.common.sync.AbstractSyncService;
import com.cosmosdash.common.sync.SyncMetrics;
import com.cosmosdash.ingestor.client.TelemetrySource;
import com.cosmosdash.ingestor.model.TelemetrySample;
import com.cosmosdash.ingestor.model.TelemetryStats;
import com.cosmosdash.ingestor.model.TimeRange;
import com.cosmosdash.ingestor.repository.TelemetryRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Periodic telemetry batches plus range, latest and aggregate reads.
 */
@Slf4j
public class TelemetrySyncService extends AbstractSyncService<List<TelemetrySample>, List<TelemetrySample>> {

    public static final String DOMAIN = "telemetry";
    public static final String LATEST_KEY_PREFIX = "telemetry:latest:";
    static final Duration LATEST_TTL = Duration.ofSeconds(30);
    static final Duration DEFAULT_WINDOW = Duration.ofHours(24);
    static final Duration MAX_WINDOW = Duration.ofDays(30);

    private static final TypeReference<List<TelemetrySample>> SAMPLES = new TypeReference<>() {};

    private final TelemetrySource source;
    private final TelemetryRepository repository;

    public TelemetrySyncService(TelemetrySource source, TelemetryRepository repository, CacheStore cache,
                                Duration lockTtl, SyncMetrics metrics, Clock clock) {
        super(DOMAIN, cache, lockTtl, metrics, clock);
        this.source = source;
        this.repository = repository;
    }

    @Override
    protected List<TelemetrySample> fetch() {
        List<TelemetrySample> batch = source.readBatch(clock.instant());
        if (batch.isEmpty()) {
            throw new FetchFailureException(DOMAIN, "telemetry source produced no samples");
        }
        return batch;
    }

    @Override
    protected List<TelemetrySample> transform(List<TelemetrySample> raw, Instant fetchedAt) {
        return raw;
    }

    @Override
    protected int persist(List<TelemetrySample> batch) {
        return repository.batchCreate(batch);
    }

    @Override
    protected void refreshCache(List<TelemetrySample> batch) {
        cacheAside.evictPrefix(LATEST_KEY_PREFIX);
    }

    // ==================== READ PATH ====================

    /**
     * Samples in range, newest first. Open ends default to the last 24 hours,
     * a start after the end is swapped with it, and ranges wider than 30 days
     * keep only their last 30 days.
     */
    public List<TelemetrySample> getHistory(Instant from, Instant to) {
        TimeRange range = resolve(from, to);
        return repository.findBetween(range.from(), range.to());
    }

    /**
     * @param limit 1..1000; anything else means 100
     */
    public List<TelemetrySample> getLatest(int limit) {
        int effectiveLimit = limit < 1 || limit > 1000 ? 100 : limit;
        return cacheAside.readThroughList(DOMAIN, LATEST_KEY_PREFIX + effectiveLimit, SAMPLES, LATEST_TTL,
                () -> repository.findLatest(effectiveLimit));
    }

    public TelemetryStats getStats(Instant from, Instant to) {
        TimeRange range = resolve(from, to);
        return repository.stats(range.from(), range.to());
    }

    /**
     * Delete samples recorded before {@code now - retention}.
     */
    public int purgeOlderThan(Duration retention) {
        Instant cutoff = clock.instant().minus(retention);
        int deleted = repository.deleteOlderThan(cutoff);
        if (deleted > 0) {
            cacheAside.evictPrefix(LATEST_KEY_PREFIX);
        }
        return deleted;
    }

    TimeRange resolve(Instant from, Instant to) {
        return TimeRange.resolve(from, to, clock.instant(), DEFAULT_WINDOW, MAX_WINDOW);
    }
}
