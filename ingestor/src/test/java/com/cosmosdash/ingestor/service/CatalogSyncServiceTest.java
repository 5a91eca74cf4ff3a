package com.cosmosdash.ingestor.service;

import com.cosmosdash.common.client.SourceClient;
import com.cosmosdash.common.exception.FetchFailureException;
import com.cosmosdash.common.sync.SyncMetrics;
import com.cosmosdash.common.sync.SyncOutcome;
import com.cosmosdash.common.sync.SyncResult;
import com.cosmosdash.common.util.JsonUtils;
import com.cosmosdash.ingestor.model.CatalogItem;
import com.cosmosdash.ingestor.model.UpsertResult;
import com.cosmosdash.ingestor.repository.CatalogRepository;
import com.cosmosdash.ingestor.support.InMemoryCacheStore;
import com.cosmosdash.ingestor.support.MutableClock;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CatalogSyncServiceTest {

    private static final Instant T0 = Instant.parse("2024-06-01T12:00:00Z");
    private static final ObjectMapper JSON = JsonUtils.newMapper();

    @Mock
    private SourceClient client;

    @Mock
    private CatalogRepository repository;

    @Captor
    private ArgumentCaptor<List<CatalogItem>> batchCaptor;

    private InMemoryCacheStore cache;
    private CatalogSyncService service;

    @BeforeEach
    void setup() {
        MutableClock clock = new MutableClock(T0);
        cache = new InMemoryCacheStore(clock);
        service = new CatalogSyncService(client, repository, cache, Duration.ofMinutes(10),
                new SyncMetrics(new SimpleMeterRegistry()), clock);
        lenient().when(client.name()).thenReturn("osdr-api");
    }

    private static CatalogItem item(String datasetId, String title) {
        return new CatalogItem(UUID.randomUUID(), datasetId, title, "public", T0, T0,
                JSON.createObjectNode().put("id", datasetId), T0);
    }

    @Nested
    @DisplayName("Transform")
    class Transform {

        @Test
        void toCatalogItem_PrimaryKeys() throws Exception {
            JsonNode raw = JSON.readTree("""
                    {"dataset_id":"OSD-87","title":"Rodent Research","status":"public",
                     "updated_at":"2024-05-01T10:00:00Z"}
                    """);

            CatalogItem item = CatalogSyncService.toCatalogItem(raw, T0);

            assertThat(item.datasetId()).isEqualTo("OSD-87");
            assertThat(item.title()).isEqualTo("Rodent Research");
            assertThat(item.status()).isEqualTo("public");
            assertThat(item.updatedAt()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
            assertThat(item.insertedAt()).isEqualTo(T0);
            assertThat(item.raw()).isEqualTo(raw);
        }

        @Test
        @DisplayName("alternate keys and epoch-second timestamps")
        void toCatalogItem_AlternateKeys() throws Exception {
            JsonNode raw = JSON.readTree("""
                    {"uuid":"abc-1","name":"Plant Biology","state":"draft","timestamp":1714557600}
                    """);

            CatalogItem item = CatalogSyncService.toCatalogItem(raw, T0);

            assertThat(item.datasetId()).isEqualTo("abc-1");
            assertThat(item.title()).isEqualTo("Plant Biology");
            assertThat(item.status()).isEqualTo("draft");
            assertThat(item.updatedAt()).isEqualTo(Instant.ofEpochSecond(1714557600));
        }

        @Test
        void toCatalogItem_MissingFields_EmptyTextNullTime() throws Exception {
            CatalogItem item = CatalogSyncService.toCatalogItem(JSON.readTree("{\"foo\":1}"), T0);

            assertThat(item.datasetId()).isEmpty();
            assertThat(item.hasNaturalKey()).isFalse();
            assertThat(item.updatedAt()).isNull();
        }

        @Test
        void sync_ResultsPath_UpsertsEveryItem() throws Exception {
            when(client.fetch()).thenReturn(JSON.readTree("""
                    {"results":[{"id":"OSD-1","title":"A"},{"id":"OSD-2","title":"B"}]}
                    """));
            when(repository.upsertAll(anyList())).thenReturn(new UpsertResult(1, 1, 0));

            SyncResult result = service.sync();

            assertThat(result.outcome()).isEqualTo(SyncOutcome.SYNCED);
            assertThat(result.items()).isEqualTo(2);
            verify(repository).upsertAll(batchCaptor.capture());
            assertThat(batchCaptor.getValue()).extracting(CatalogItem::datasetId)
                    .containsExactly("OSD-1", "OSD-2");
        }

        @Test
        void sync_TopLevelArray_Accepted() throws Exception {
            when(client.fetch()).thenReturn(JSON.readTree("[{\"id\":\"OSD-9\"}]"));
            when(repository.upsertAll(anyList())).thenReturn(new UpsertResult(1, 0, 0));

            assertThat(service.sync().outcome()).isEqualTo(SyncOutcome.SYNCED);
        }

        @Test
        @DisplayName("a body with no declared item list is malformed")
        void sync_NoItemList_FetchFailure() throws Exception {
            when(client.fetch()).thenReturn(JSON.readTree("{\"data\":{\"studies\":[]}}"));

            assertThatThrownBy(() -> service.sync())
                    .isInstanceOf(FetchFailureException.class)
                    .hasMessageContaining("malformed body");

            verifyNoInteractions(repository);
            assertThat(cache.exists("osdr:last_fetch")).isFalse();
        }

        @Test
        @DisplayName("successful upsert evicts cached pages and items")
        void sync_EvictsReadCache() throws Exception {
            cache.set("osdr:list:1:20", "[]", Duration.ofMinutes(5));
            cache.set("osdr:item:OSD-1", "{}", Duration.ofMinutes(5));
            when(client.fetch()).thenReturn(JSON.readTree("{\"items\":[{\"id\":\"OSD-1\"}]}"));
            when(repository.upsertAll(anyList())).thenReturn(new UpsertResult(0, 1, 0));

            service.sync();

            assertThat(cache.keys("osdr:list:*")).isEmpty();
            assertThat(cache.keys("osdr:item:*")).isEmpty();
            assertThat(cache.exists("osdr:last_fetch")).isTrue();
        }
    }

    @Nested
    @DisplayName("Read path")
    class ReadPath {

        @Test
        void getList_OutOfRangeArguments_Clamped() {
            when(repository.findPage(1, 20)).thenReturn(List.of(item("OSD-1", "A")));

            List<CatalogItem> page = service.getList(0, 500);

            assertThat(page).hasSize(1);
            assertThat(cache.exists("osdr:list:1:20")).isTrue();
        }

        @Test
        void getList_SecondCall_ServedFromCache() {
            when(repository.findPage(2, 10)).thenReturn(List.of(item("OSD-1", "A")));

            service.getList(2, 10);
            List<CatalogItem> cached = service.getList(2, 10);

            assertThat(cached).extracting(CatalogItem::datasetId).containsExactly("OSD-1");
            verify(repository, times(1)).findPage(2, 10);
        }

        @Test
        @DisplayName("empty pages are never cached")
        void getList_EmptyPage_NotCached() {
            when(repository.findPage(1, 20)).thenReturn(List.of());

            assertThat(service.getList(1, 20)).isEmpty();
            assertThat(cache.exists("osdr:list:1:20")).isFalse();
        }

        @Test
        void getByDatasetId_ReadThrough() {
            CatalogItem stored = item("OSD-87", "Rodent Research");
            when(repository.findByDatasetId("OSD-87")).thenReturn(Optional.of(stored));

            assertThat(service.getByDatasetId("OSD-87")).contains(stored);
            assertThat(service.getByDatasetId("OSD-87")).get()
                    .extracting(CatalogItem::title).isEqualTo("Rodent Research");
            verify(repository, times(1)).findByDatasetId("OSD-87");
        }

        @Test
        void search_BlankQuery_NoQuery() {
            assertThat(service.search("  ", 10)).isEmpty();
            verifyNoInteractions(repository);
        }

        @Test
        void search_LimitClampedAndQueryTrimmed() {
            when(repository.search("rodent", 10)).thenReturn(List.of());

            service.search(" rodent ", 99);

            verify(repository).search("rodent", 10);
        }
    }
}
