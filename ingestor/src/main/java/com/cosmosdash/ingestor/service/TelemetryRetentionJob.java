package com.cosmosdash.ingestor.service;

import com.cosmosdash.common.logging.LogContext;
import com.cosmosdash.ingestor.config.IngestorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Daily sweep of telemetry older than the retention window.
 * Runs outside the synchronization workers.
 */
@Slf4j
@Component
public class TelemetryRetentionJob {

    private final TelemetrySyncService telemetry;
    private final Duration retention;

    public TelemetryRetentionJob(TelemetrySyncService telemetry, IngestorProperties properties) {
        this.telemetry = telemetry;
        this.retention = Duration.ofDays(properties.telemetry().retentionDays());
    }

    @Scheduled(cron = "${ingestor.telemetry.retention-cron:0 0 3 * * *}")
    public void purge() {
        LogContext.with(LogContext.WORKER, "telemetry-retention")
                .and(LogContext.DOMAIN, TelemetrySyncService.DOMAIN)
                .run(this::sweep);
    }

    private void sweep() {
        log.info("Starting telemetry retention sweep (retention={} days)", retention.toDays());
        try {
            int deleted = telemetry.purgeOlderThan(retention);
            log.info("Telemetry retention sweep removed {} sample(s)", deleted);
        } catch (DataAccessException e) {
            log.error("Telemetry retention sweep failed: {}", e.getMessage(), e);
        }
    }
}
