package com.cosmosdash.ingestor.client;

import com.cosmosdash.ingestor.model.TelemetrySample;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.random.RandomGenerator;

/**
 * Simulated spacecraft bus: readings one second apart, voltage in
 * [3.2, 12.6] V and temperature in [-50, 80] °C.
 */
public class SyntheticTelemetrySource implements TelemetrySource {

    public static final double MIN_VOLTAGE = 3.2;
    public static final double MAX_VOLTAGE = 12.6;
    public static final double MIN_TEMPERATURE = -50.0;
    public static final double MAX_TEMPERATURE = 80.0;

    private static final DateTimeFormatter FILE_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final int batchSize;
    private final RandomGenerator random;

    public SyntheticTelemetrySource(int batchSize, RandomGenerator random) {
        this.batchSize = batchSize;
        this.random = random;
    }

    @Override
    public List<TelemetrySample> readBatch(Instant endingAt) {
        String sourceFile = fileNameFor(endingAt);
        List<TelemetrySample> samples = new ArrayList<>(batchSize);
        for (int i = 0; i < batchSize; i++) {
            Instant recordedAt = endingAt.minusSeconds(batchSize - 1 - i);
            samples.add(new TelemetrySample(
                    UUID.randomUUID(),
                    recordedAt,
                    round2(MIN_VOLTAGE + random.nextDouble() * (MAX_VOLTAGE - MIN_VOLTAGE)),
                    round2(MIN_TEMPERATURE + random.nextDouble() * (MAX_TEMPERATURE - MIN_TEMPERATURE)),
                    sourceFile,
                    endingAt));
        }
        return samples;
    }

    public static String fileNameFor(Instant at) {
        return "telemetry_" + FILE_STAMP.format(at) + ".csv";
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
