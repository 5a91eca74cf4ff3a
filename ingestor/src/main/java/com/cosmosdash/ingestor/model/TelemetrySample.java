package com.cosmosdash.ingestor.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable voltage/temperature reading with the batch file it came from.
 */
public record TelemetrySample(
        UUID id,
        Instant recordedAt,
        double voltage,
        double temperature,
        String sourceFile,
        Instant createdAt
) {}
