package com.cosmosdash.ingestor.client;

import com.cosmosdash.ingestor.model.TelemetrySample;

import java.time.Instant;
import java.util.List;

/**
 * Produces one batch of telemetry readings per tick.
 */
public interface TelemetrySource {

    /**
     * @param endingAt time of the newest reading in the batch
     */
    List<TelemetrySample> readBatch(Instant endingAt);
}
