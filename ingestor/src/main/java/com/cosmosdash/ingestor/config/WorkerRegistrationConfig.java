package com.cosmosdash.ingestor.config;

import com.cosmosdash.common.client.SourceClient;
import com.cosmosdash.common.exception.ConfigurationFailureException;
import com.cosmosdash.common.lifecycle.PeriodicWorker;
import com.cosmosdash.common.lifecycle.Scheduler;
import com.cosmosdash.common.lifecycle.Worker;
import com.cosmosdash.common.sync.SyncService;
import com.cosmosdash.ingestor.service.CatalogSyncService;
import com.cosmosdash.ingestor.service.FeedSyncService;
import com.cosmosdash.ingestor.service.PositionSyncService;
import com.cosmosdash.ingestor.service.TelemetrySyncService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the scheduler and registers one worker per enabled domain, in a
 * fixed order. A worker whose source is misconfigured is left out and
 * reported once; the others still run.
 */
@Slf4j
@Configuration
public class WorkerRegistrationConfig {

    @Bean
    public Scheduler syncScheduler(IngestorProperties properties,
                                   PositionSyncService positionSyncService,
                                   CatalogSyncService catalogSyncService,
                                   @Qualifier("apodSyncService") FeedSyncService apodSyncService,
                                   @Qualifier("neoSyncService") FeedSyncService neoSyncService,
                                   TelemetrySyncService telemetrySyncService,
                                   @Qualifier("issClient") SourceClient issClient,
                                   @Qualifier("osdrClient") SourceClient osdrClient,
                                   @Qualifier("apodClient") SourceClient apodClient,
                                   @Qualifier("neoClient") SourceClient neoClient) {
        IngestorProperties.Workers workers = properties.workers();
        Scheduler scheduler = new Scheduler(properties.scheduler().shutdownTimeout());

        register(scheduler, "iss", workers.iss(), positionSyncService, issClient);
        register(scheduler, "osdr", workers.osdr(), catalogSyncService, osdrClient);
        register(scheduler, "apod", workers.apod(), apodSyncService, apodClient);
        register(scheduler, "neo", workers.neo(), neoSyncService, neoClient);
        register(scheduler, "telemetry", workers.telemetry(), telemetrySyncService, null);

        log.info("Registered {} synchronization worker(s): {}", scheduler.workers().size(),
                scheduler.workers().stream().map(Worker::name).toList());
        return scheduler;
    }

    static boolean register(Scheduler scheduler, String name, IngestorProperties.WorkerConfig config,
                            SyncService service, SourceClient client) {
        if (!config.isEnabled()) {
            log.info("Worker {} disabled by configuration", name);
            return false;
        }
        if (client != null) {
            try {
                client.validate();
            } catch (ConfigurationFailureException e) {
                log.error("{} [{}], worker not started", e.getMessage(), e.getErrorCode());
                return false;
            }
        }
        scheduler.addWorker(new PeriodicWorker(name, service, config.toSettings()));
        return true;
    }
}
