package com.cosmosdash.ingestor.config;

import com.cosmosdash.common.cache.CacheStore;
import com.cosmosdash.common.client.SourceClient;
import com.cosmosdash.common.sync.SyncMetrics;
import com.cosmosdash.ingestor.client.TelemetrySource;
import com.cosmosdash.ingestor.model.FeedSource;
import com.cosmosdash.ingestor.repository.CatalogRepository;
import com.cosmosdash.ingestor.repository.FeedSnapshotRepository;
import com.cosmosdash.ingestor.repository.PositionRepository;
import com.cosmosdash.ingestor.repository.TelemetryRepository;
import com.cosmosdash.ingestor.service.CatalogSyncService;
import com.cosmosdash.ingestor.service.FeedSyncService;
import com.cosmosdash.ingestor.service.PositionSyncService;
import com.cosmosdash.ingestor.service.TelemetrySyncService;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * One synchronization service per domain. Services exist even when their
 * worker is disabled so the read path keeps serving stored data.
 */
@Configuration
public class SyncServiceConfig {

    private final IngestorProperties.Workers workers;

    public SyncServiceConfig(IngestorProperties properties) {
        this.workers = properties.workers();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SyncMetrics syncMetrics(MeterRegistry meterRegistry) {
        return new SyncMetrics(meterRegistry);
    }

    @Bean
    public PositionSyncService positionSyncService(@Qualifier("issClient") SourceClient client,
                                                   PositionRepository repository, CacheStore cache,
                                                   SyncMetrics metrics, Clock clock) {
        return new PositionSyncService(client, repository, cache, workers.iss().lockTtl(), metrics, clock);
    }

    @Bean
    public CatalogSyncService catalogSyncService(@Qualifier("osdrClient") SourceClient client,
                                                 CatalogRepository repository, CacheStore cache,
                                                 SyncMetrics metrics, Clock clock) {
        return new CatalogSyncService(client, repository, cache, workers.osdr().lockTtl(), metrics, clock);
    }

    @Bean
    public FeedSyncService apodSyncService(@Qualifier("apodClient") SourceClient client,
                                           FeedSnapshotRepository repository, CacheStore cache,
                                           SyncMetrics metrics, Clock clock) {
        return new FeedSyncService(FeedSource.APOD, client, repository, cache, workers.apod().lockTtl(),
                metrics, clock);
    }

    @Bean
    public FeedSyncService neoSyncService(@Qualifier("neoClient") SourceClient client,
                                          FeedSnapshotRepository repository, CacheStore cache,
                                          SyncMetrics metrics, Clock clock) {
        return new FeedSyncService(FeedSource.NEO, client, repository, cache, workers.neo().lockTtl(),
                metrics, clock);
    }

    @Bean
    public TelemetrySyncService telemetrySyncService(TelemetrySource source, TelemetryRepository repository,
                                                     CacheStore cache, SyncMetrics metrics, Clock clock) {
        return new TelemetrySyncService(source, repository, cache, workers.telemetry().lockTtl(), metrics, clock);
    }
}
