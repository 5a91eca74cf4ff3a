package com.cosmosdash.ingestor.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Aggregates over a telemetry range. Averages and extremes are null when the range is empty.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TelemetryStats(
        long count,
        Double avgVoltage,
        Double minVoltage,
        Double maxVoltage,
        Double avgTemperature,
        Double minTemperature,
        Double maxTemperature
) {

    public static TelemetryStats empty() {
        return new TelemetryStats(0, null, null, null, null, null, null);
    }
}
