package com.cosmosdash.ingestor.config;

import com.cosmosdash.common.lifecycle.WorkerSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Type-safe configuration for the ingestor.
 * Maps to YAML properties under the 'ingestor' prefix.
 */
@ConfigurationProperties(prefix = "ingestor")
public record IngestorProperties(
        SchedulerConfig scheduler,
        Workers workers,
        Sources sources,
        TelemetryConfig telemetry
) {

    /**
     * Constructor with null-safe defaults.
     */
    public IngestorProperties {
        if (scheduler == null) {
            scheduler = new SchedulerConfig(null);
        }
        if (workers == null) {
            workers = new Workers(null, null, null, null, null);
        }
        if (sources == null) {
            sources = new Sources(null, null, null, null);
        }
        if (telemetry == null) {
            telemetry = new TelemetryConfig(0, 0, null);
        }
    }

    // ═══════════════════════════════════════════════════════════════════════════
    // SCHEDULER
    // ═══════════════════════════════════════════════════════════════════════════

    public record SchedulerConfig(Duration shutdownTimeout) {
        public SchedulerConfig {
            if (shutdownTimeout == null || shutdownTimeout.isNegative() || shutdownTimeout.isZero()) {
                shutdownTimeout = Duration.ofSeconds(10);
            }
        }
    }

    // ═══════════════════════════════════════════════════════════════════════════
    // WORKERS
    // ═══════════════════════════════════════════════════════════════════════════

    /**
     * One entry per synchronization domain. Unset fields fall back to the
     * per-domain defaults below.
     */
    public record Workers(
            WorkerConfig iss,
            WorkerConfig osdr,
            WorkerConfig apod,
            WorkerConfig neo,
            WorkerConfig telemetry
    ) {
        public Workers {
            iss = WorkerConfig.merge(iss, new WorkerConfig(true, Duration.ofSeconds(120), true,
                    Duration.ofSeconds(30), Duration.ofSeconds(120)));
            osdr = WorkerConfig.merge(osdr, new WorkerConfig(true, Duration.ofSeconds(3600), true,
                    Duration.ofSeconds(60), Duration.ofMinutes(10)));
            apod = WorkerConfig.merge(apod, new WorkerConfig(true, Duration.ofSeconds(3600), true,
                    Duration.ofSeconds(60), Duration.ofHours(1)));
            neo = WorkerConfig.merge(neo, new WorkerConfig(true, Duration.ofSeconds(7200), true,
                    Duration.ofSeconds(60), Duration.ofHours(2)));
            telemetry = WorkerConfig.merge(telemetry, new WorkerConfig(true, Duration.ofSeconds(300), true,
                    Duration.ofSeconds(30), Duration.ofSeconds(270)));
        }
    }

    /**
     * @param lockTtl minimum time between two upstream fetches of this domain
     */
    public record WorkerConfig(
            Boolean enabled,
            Duration interval,
            Boolean runOnStart,
            Duration invocationTimeout,
            Duration lockTtl
    ) {
        static WorkerConfig merge(WorkerConfig configured, WorkerConfig defaults) {
            if (configured == null) {
                return defaults;
            }
            return new WorkerConfig(
                    configured.enabled != null ? configured.enabled : defaults.enabled,
                    positiveOr(configured.interval, defaults.interval),
                    configured.runOnStart != null ? configured.runOnStart : defaults.runOnStart,
                    positiveOr(configured.invocationTimeout, defaults.invocationTimeout),
                    positiveOr(configured.lockTtl, defaults.lockTtl));
        }

        public boolean isEnabled() {
            return Boolean.TRUE.equals(enabled);
        }

        public WorkerSettings toSettings() {
            return new WorkerSettings(interval, Boolean.TRUE.equals(runOnStart), invocationTimeout);
        }

        private static Duration positiveOr(Duration value, Duration fallback) {
            return value != null && !value.isNegative() && !value.isZero() ? value : fallback;
        }
    }

    // ═══════════════════════════════════════════════════════════════════════════
    // UPSTREAM SOURCES
    // ═══════════════════════════════════════════════════════════════════════════

    public record Sources(
            Duration connectTimeout,
            Duration readTimeout,
            IssSource iss,
            NasaSource nasa
    ) {
        public Sources {
            if (connectTimeout == null) connectTimeout = Duration.ofSeconds(10);
            if (readTimeout == null) readTimeout = Duration.ofSeconds(25);
            if (iss == null) iss = new IssSource(null);
            if (nasa == null) nasa = new NasaSource(null, null, null, null, 0);
        }
    }

    public record IssSource(String url) {
        public IssSource {
            if (url == null) url = "https://api.wheretheiss.at/v1/satellites/25544";
        }
    }

    /**
     * A blank URL disables the matching worker. A blank api key falls back to
     * NASA's rate-limited DEMO_KEY.
     */
    public record NasaSource(
            String apiKey,
            String osdrUrl,
            String apodUrl,
            String neoUrl,
            int neoDays
    ) {
        public NasaSource {
            if (osdrUrl == null) osdrUrl = "https://osdr.nasa.gov/osdr/data/osd/files/87.1";
            if (apodUrl == null) apodUrl = "https://api.nasa.gov/planetary/apod";
            if (neoUrl == null) neoUrl = "https://api.nasa.gov/neo/rest/v1/feed";
            if (neoDays <= 0 || neoDays > 7) neoDays = 7;
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }

        public String effectiveApiKey() {
            return hasApiKey() ? apiKey : "DEMO_KEY";
        }
    }

    // ═══════════════════════════════════════════════════════════════════════════
    // TELEMETRY
    // ═══════════════════════════════════════════════════════════════════════════

    public record TelemetryConfig(
            int batchSize,
            int retentionDays,
            String retentionCron
    ) {
        public TelemetryConfig {
            if (batchSize <= 0) batchSize = 100;
            if (retentionDays <= 0) retentionDays = 30;
            if (retentionCron == null || retentionCron.isBlank()) retentionCron = "0 0 3 * * *";
        }
    }
}
