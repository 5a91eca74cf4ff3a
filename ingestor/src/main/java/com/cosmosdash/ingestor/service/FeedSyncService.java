package com.cosmosdash.ingestor.service;

import com.cosmosdash.common.cache.CacheStore;
import com.cosmosdash.common.client.SourceClient;
import com.cosmosdash.common.exception.FetchFailureException;
import com.cosmosdash.common.sync.AbstractSyncService;
import com.cosmosdash.common.sync.SyncMetrics;
import com.cosmosdash.ingestor.model.FeedSnapshot;
import com.cosmosdash.ingestor.model.FeedSource;
import com.cosmosdash.ingestor.repository.FeedSnapshotRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Feed sources kept as whole snapshots. One instance per {@link FeedSource}.
 */
public class FeedSyncService extends AbstractSyncService<JsonNode, FeedSnapshot> {

    private static final TypeReference<FeedSnapshot> SNAPSHOT = new TypeReference<>() {};

    private final FeedSource source;
    private final SourceClient client;
    private final FeedSnapshotRepository repository;

    public FeedSyncService(FeedSource source, SourceClient client, FeedSnapshotRepository repository,
                           CacheStore cache, Duration lockTtl, SyncMetrics metrics, Clock clock) {
        super(source.domain(), cache, lockTtl, metrics, clock);
        this.source = source;
        this.client = client;
        this.repository = repository;
    }

    public static String latestKey(FeedSource source) {
        return source.domain() + ":latest";
    }

    public FeedSource source() {
        return source;
    }

    @Override
    protected JsonNode fetch() {
        return client.fetch();
    }

    @Override
    protected FeedSnapshot transform(JsonNode raw, Instant fetchedAt) {
        if (!raw.isContainerNode() || raw.isEmpty()) {
            throw new FetchFailureException(client.name(), "malformed body: expected a non-empty JSON document");
        }
        return new FeedSnapshot(UUID.randomUUID(), source, fetchedAt, raw);
    }

    @Override
    protected int persist(FeedSnapshot batch) {
        repository.create(batch);
        return 1;
    }

    @Override
    protected void refreshCache(FeedSnapshot batch) {
        cacheAside.write(latestKey(source), batch, source.cacheTtl());
    }

    /**
     * Last stored snapshot. Never calls the upstream.
     */
    public Optional<FeedSnapshot> getLatest() {
        return cacheAside.readThrough(domain(), latestKey(source), SNAPSHOT, source.cacheTtl(),
                () -> repository.findLatest(source));
    }

    public List<FeedSnapshot> getHistory(Instant from, Instant to) {
        return repository.findBetween(source, from, to);
    }
}
