package com.cosmosdash.ingestor.service;

import com.cosmosdash.common.cache.CacheStore;
import com.cosmosdash.common.client.SourceClient;
import com.cosmosdash.common.exception.FetchFailureException;
import com.cosmosdash.common.sync.AbstractSyncService;
import com.cosmosdash.common.sync.SyncMetrics;
import com.cosmosdash.common.util.GeoUtils;
import com.cosmosdash.common.util.PayloadSchema;
import com.cosmosdash.ingestor.model.PositionLog;
import com.cosmosdash.ingestor.model.TrendResult;
import com.cosmosdash.ingestor.repository.PositionRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * ISS position synchronization and its read path (latest, trend, history).
 */
@Slf4j
public class PositionSyncService extends AbstractSyncService<JsonNode, PositionLog> {

    public static final String DOMAIN = "iss";
    public static final String LAST_POSITION_KEY = "iss:last_position";
    static final Duration LAST_POSITION_TTL = Duration.ofMinutes(2);
    static final Duration TREND_TTL = Duration.ofSeconds(30);
    static final Duration HISTORY_TTL = Duration.ofMinutes(5);
    static final int DEFAULT_TREND_LIMIT = 240;
    static final int DEFAULT_HISTORY_HOURS = 24;

    static final PayloadSchema SCHEMA = PayloadSchema.builder()
            .field("latitude", "latitude", "lat")
            .field("longitude", "longitude", "lon", "lng")
            .field("velocity", "velocity", "speed")
            .build();

    private static final TypeReference<PositionLog> POSITION = new TypeReference<>() {};
    private static final TypeReference<TrendResult> TREND = new TypeReference<>() {};
    private static final TypeReference<List<PositionLog>> POSITIONS = new TypeReference<>() {};

    private final SourceClient client;
    private final PositionRepository repository;

    public PositionSyncService(SourceClient client, PositionRepository repository, CacheStore cache,
                               Duration lockTtl, SyncMetrics metrics, Clock clock) {
        super(DOMAIN, cache, lockTtl, metrics, clock);
        this.client = client;
        this.repository = repository;
    }

    @Override
    protected JsonNode fetch() {
        return client.fetch();
    }

    @Override
    protected PositionLog transform(JsonNode raw, Instant fetchedAt) {
        if (!raw.isObject()) {
            throw new FetchFailureException(client.name(), "malformed body: expected a JSON object");
        }
        return new PositionLog(UUID.randomUUID(), fetchedAt, client.sourceUrl(), raw, fetchedAt);
    }

    @Override
    protected int persist(PositionLog batch) {
        repository.create(batch);
        return 1;
    }

    @Override
    protected void refreshCache(PositionLog batch) {
        cacheAside.write(LAST_POSITION_KEY, batch, LAST_POSITION_TTL);
    }

    // ==================== READ PATH ====================

    /**
     * @return empty when nothing has been fetched yet
     */
    public Optional<PositionLog> getLatest() {
        return cacheAside.readThrough(DOMAIN, LAST_POSITION_KEY, POSITION, LAST_POSITION_TTL,
                repository::findLatest);
    }

    /**
     * Movement between the two most recent fetches. {@code limit} only scopes
     * the cache entry; non-positive values mean 240.
     */
    public TrendResult getTrend(int limit) {
        int effectiveLimit = limit <= 0 ? DEFAULT_TREND_LIMIT : limit;
        String key = "iss:trend:" + effectiveLimit;
        return cacheAside.readThrough(DOMAIN, key, TREND, TREND_TTL,
                        () -> Optional.of(computeTrend(repository.findLatest(2))))
                .orElseGet(TrendResult::neutral);
    }

    /**
     * Fetches from the last {@code hours} hours, newest first. Non-positive means 24.
     */
    public List<PositionLog> getHistory(int hours) {
        int effectiveHours = hours <= 0 ? DEFAULT_HISTORY_HOURS : hours;
        String key = "iss:history:" + effectiveHours + "h";
        Instant since = clock.instant().minus(Duration.ofHours(effectiveHours));
        return cacheAside.readThroughList(DOMAIN, key, POSITIONS, HISTORY_TTL,
                () -> repository.findSince(since));
    }

    public List<PositionLog> getHistory(Instant from, Instant to) {
        return repository.findBetween(from, to);
    }

    /**
     * @param newestFirst at most two positions, newest first
     */
    static TrendResult computeTrend(List<PositionLog> newestFirst) {
        if (newestFirst.size() < 2) {
            return TrendResult.neutral();
        }
        PositionLog current = newestFirst.get(0);
        PositionLog previous = newestFirst.get(1);

        double fromLat = SCHEMA.number(previous.payload(), "latitude");
        double fromLon = SCHEMA.number(previous.payload(), "longitude");
        double toLat = SCHEMA.number(current.payload(), "latitude");
        double toLon = SCHEMA.number(current.payload(), "longitude");
        double velocity = SCHEMA.number(current.payload(), "velocity");

        double deltaKm = GeoUtils.haversineKm(fromLat, fromLon, toLat, toLon);
        double dtSec = Duration.between(previous.fetchedAt(), current.fetchedAt()).toMillis() / 1000.0;

        return new TrendResult(
                deltaKm > TrendResult.MOVEMENT_THRESHOLD_KM,
                deltaKm,
                dtSec,
                velocity > 0 ? velocity * 3.6 : null,
                previous.fetchedAt(),
                current.fetchedAt(),
                fromLat,
                fromLon,
                toLat,
                toLon);
    }
}
