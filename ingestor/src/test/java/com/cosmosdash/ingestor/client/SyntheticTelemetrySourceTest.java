package com.cosmosdash.ingestor.client;

import com.cosmosdash.ingestor.model.TelemetrySample;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.SplittableRandom;

import static org.assertj.core.api.Assertions.*;

class SyntheticTelemetrySourceTest {

    private static final Instant END = Instant.parse("2024-06-01T12:00:00Z");

    private final SyntheticTelemetrySource source = new SyntheticTelemetrySource(100, new SplittableRandom(42));

    @Test
    void readBatch_OneSecondApartEndingAtTick() {
        List<TelemetrySample> batch = source.readBatch(END);

        assertThat(batch).hasSize(100);
        assertThat(batch.get(0).recordedAt()).isEqualTo(END.minusSeconds(99));
        assertThat(batch.get(99).recordedAt()).isEqualTo(END);
        assertThat(batch).extracting(TelemetrySample::id).doesNotHaveDuplicates();
    }

    @Test
    void readBatch_ValuesWithinPhysicalRange() {
        assertThat(source.readBatch(END)).allSatisfy(sample -> {
            assertThat(sample.voltage()).isBetween(SyntheticTelemetrySource.MIN_VOLTAGE,
                    SyntheticTelemetrySource.MAX_VOLTAGE);
            assertThat(sample.temperature()).isBetween(SyntheticTelemetrySource.MIN_TEMPERATURE,
                    SyntheticTelemetrySource.MAX_TEMPERATURE);
            assertThat(sample.voltage() * 100).isCloseTo(Math.rint(sample.voltage() * 100), within(1e-6));
        });
    }

    @Test
    void readBatch_SourceFileNamedAfterTick() {
        assertThat(source.readBatch(END))
                .extracting(TelemetrySample::sourceFile)
                .containsOnly("telemetry_20240601_120000.csv");
    }
}
