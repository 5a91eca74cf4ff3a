package com.cosmosdash.ingestor.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * Movement between the two latest ISS positions. Never persisted.
 *
 * @param deltaKm     great-circle distance between the positions
 * @param dtSec       seconds between the two fetch times
 * @param velocityKmh upstream velocity of the newer sample, converted from m/s
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TrendResult(
        boolean movement,
        double deltaKm,
        double dtSec,
        Double velocityKmh,
        Instant fromTime,
        Instant toTime,
        Double fromLat,
        Double fromLon,
        Double toLat,
        Double toLon
) {

    /** Movement threshold in kilometres. */
    public static final double MOVEMENT_THRESHOLD_KM = 0.1;

    public static TrendResult neutral() {
        return new TrendResult(false, 0.0, 0.0, null, null, null, null, null, null, null);
    }
}
