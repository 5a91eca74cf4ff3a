package com.cosmosdash.ingestor.service;

import com.cosmosdash.common.cache.CacheStore;
import com.cosmosdash.common.client.SourceClient;
import com.cosmosdash.common.exception.FetchFailureException;
import com.cosmosdash.common.sync.AbstractSyncService;
import com.cosmosdash.common.sync.SyncMetrics;
import com.cosmosdash.common.util.PayloadSchema;
import com.cosmosdash.ingestor.model.CatalogItem;
import com.cosmosdash.ingestor.model.UpsertResult;
import com.cosmosdash.ingestor.repository.CatalogRepository;
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
 * OSDR dataset catalog: bulk fetch, natural-key upsert, paginated reads.
 */
@Slf4j
public class CatalogSyncService extends AbstractSyncService<JsonNode, List<CatalogItem>> {

    public static final String DOMAIN = "osdr";
    public static final String LIST_KEY_PREFIX = "osdr:list:";
    public static final String ITEM_KEY_PREFIX = "osdr:item:";
    static final Duration LIST_TTL = Duration.ofMinutes(5);
    static final Duration ITEM_TTL = Duration.ofMinutes(5);

    static final PayloadSchema SCHEMA = PayloadSchema.builder()
            .itemsAt("items", "results", PayloadSchema.ROOT)
            .field("datasetId", "dataset_id", "id", "uuid")
            .field("title", "title", "name", "label")
            .field("status", "status", "state", "lifecycle")
            .field("updatedAt", "updated_at", "modified", "lastUpdated", "timestamp")
            .build();

    private static final TypeReference<List<CatalogItem>> ITEMS = new TypeReference<>() {};
    private static final TypeReference<CatalogItem> ITEM = new TypeReference<>() {};

    private final SourceClient client;
    private final CatalogRepository repository;

    public CatalogSyncService(SourceClient client, CatalogRepository repository, CacheStore cache,
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
    protected List<CatalogItem> transform(JsonNode raw, Instant fetchedAt) {
        List<JsonNode> items = SCHEMA.items(raw).orElseThrow(() -> new FetchFailureException(client.name(),
                "malformed body: no item list at " + SCHEMA.itemPaths()));
        return items.stream()
                .map(item -> toCatalogItem(item, fetchedAt))
                .toList();
    }

    @Override
    protected int persist(List<CatalogItem> batch) {
        UpsertResult result = repository.upsertAll(batch);
        log.info("OSDR upsert: {} inserted, {} updated, {} skipped",
                result.inserted(), result.updated(), result.skipped());
        return result.written();
    }

    @Override
    protected void refreshCache(List<CatalogItem> batch) {
        cacheAside.evictPrefix(LIST_KEY_PREFIX);
        cacheAside.evictPrefix(ITEM_KEY_PREFIX);
    }

    // ==================== READ PATH ====================

    /**
     * Most recently updated first, undated items last.
     *
     * @param page  1-based; values below 1 mean 1
     * @param limit 1..100; anything else means 20
     */
    public List<CatalogItem> getList(int page, int limit) {
        int effectivePage = Math.max(page, 1);
        int effectiveLimit = limit < 1 || limit > 100 ? 20 : limit;
        String key = LIST_KEY_PREFIX + effectivePage + ":" + effectiveLimit;
        return cacheAside.readThroughList(DOMAIN, key, ITEMS, LIST_TTL,
                () -> repository.findPage(effectivePage, effectiveLimit));
    }

    public Optional<CatalogItem> getByDatasetId(String datasetId) {
        return cacheAside.readThrough(DOMAIN, ITEM_KEY_PREFIX + datasetId, ITEM, ITEM_TTL,
                () -> repository.findByDatasetId(datasetId));
    }

    public Optional<CatalogItem> getById(UUID id) {
        return repository.findById(id);
    }

    /**
     * Case-insensitive match on title or dataset id.
     *
     * @param limit 1..50; anything else means 10
     */
    public List<CatalogItem> search(String query, int limit) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        int effectiveLimit = limit < 1 || limit > 50 ? 10 : limit;
        return repository.search(query.trim(), effectiveLimit);
    }

    public long count() {
        return repository.count();
    }

    static CatalogItem toCatalogItem(JsonNode item, Instant fetchedAt) {
        return new CatalogItem(
                UUID.randomUUID(),
                SCHEMA.text(item, "datasetId"),
                SCHEMA.text(item, "title"),
                SCHEMA.text(item, "status"),
                SCHEMA.instant(item, "updatedAt").orElse(null),
                fetchedAt,
                item,
                fetchedAt);
    }
}
