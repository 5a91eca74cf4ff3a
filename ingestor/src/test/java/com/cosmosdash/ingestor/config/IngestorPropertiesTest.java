package com.cosmosdash.ingestor.config;

import com.cosmosdash.common.lifecycle.WorkerSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class IngestorPropertiesTest {

    private static IngestorProperties bind(Map<String, String> values) {
        Binder binder = new Binder(new MapConfigurationPropertySource(values));
        return binder.bindOrCreate("ingestor", IngestorProperties.class);
    }

    @Test
    @DisplayName("empty configuration yields the per-domain defaults")
    void defaults() {
        IngestorProperties properties = bind(Map.of());
        IngestorProperties.Workers workers = properties.workers();

        assertThat(workers.iss().interval()).isEqualTo(Duration.ofSeconds(120));
        assertThat(workers.iss().lockTtl()).isEqualTo(Duration.ofSeconds(120));
        assertThat(workers.iss().runOnStart()).isTrue();
        assertThat(workers.osdr().interval()).isEqualTo(Duration.ofHours(1));
        assertThat(workers.osdr().lockTtl()).isEqualTo(Duration.ofMinutes(10));
        assertThat(workers.apod().runOnStart()).isTrue();
        assertThat(workers.neo().runOnStart()).isTrue();
        assertThat(workers.osdr().runOnStart()).isTrue();
        assertThat(workers.telemetry().runOnStart()).isTrue();
        assertThat(workers.neo().interval()).isEqualTo(Duration.ofHours(2));
        assertThat(workers.telemetry().lockTtl()).isEqualTo(Duration.ofSeconds(270));
        assertThat(properties.scheduler().shutdownTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(properties.telemetry().batchSize()).isEqualTo(100);
        assertThat(properties.telemetry().retentionDays()).isEqualTo(30);
    }

    @Test
    @DisplayName("partial worker config keeps the defaults it does not override")
    void partialOverride_Merged() {
        IngestorProperties properties = bind(Map.of(
                "ingestor.workers.iss.interval", "30s",
                "ingestor.workers.apod.enabled", "false"));

        IngestorProperties.WorkerConfig iss = properties.workers().iss();
        assertThat(iss.interval()).isEqualTo(Duration.ofSeconds(30));
        assertThat(iss.lockTtl()).isEqualTo(Duration.ofSeconds(120));
        assertThat(iss.isEnabled()).isTrue();
        assertThat(properties.workers().apod().isEnabled()).isFalse();
    }

    @Test
    void runOnStart_StaysConfigurable() {
        IngestorProperties properties = bind(Map.of("ingestor.workers.neo.run-on-start", "false"));

        assertThat(properties.workers().neo().runOnStart()).isFalse();
        assertThat(properties.workers().apod().runOnStart()).isTrue();
    }

    @Test
    void nonPositiveDurations_FallBackToDefaults() {
        IngestorProperties properties = bind(Map.of(
                "ingestor.workers.telemetry.interval", "0s",
                "ingestor.workers.telemetry.lock-ttl", "-5s"));

        IngestorProperties.WorkerConfig telemetry = properties.workers().telemetry();
        assertThat(telemetry.interval()).isEqualTo(Duration.ofSeconds(300));
        assertThat(telemetry.lockTtl()).isEqualTo(Duration.ofSeconds(270));
    }

    @Test
    void toSettings_CarriesScheduleFields() {
        WorkerSettings settings = bind(Map.of()).workers().osdr().toSettings();

        assertThat(settings.interval()).isEqualTo(Duration.ofHours(1));
        assertThat(settings.runOnStart()).isTrue();
        assertThat(settings.invocationTimeout()).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    @DisplayName("missing NASA key falls back to DEMO_KEY")
    void nasaKey_Fallback() {
        IngestorProperties.NasaSource withoutKey = bind(Map.of()).sources().nasa();
        IngestorProperties.NasaSource withKey = bind(Map.of("ingestor.sources.nasa.api-key", "abc123"))
                .sources().nasa();

        assertThat(withoutKey.hasApiKey()).isFalse();
        assertThat(withoutKey.effectiveApiKey()).isEqualTo("DEMO_KEY");
        assertThat(withKey.effectiveApiKey()).isEqualTo("abc123");
        assertThat(withoutKey.neoDays()).isEqualTo(7);
    }
}
