package com.cosmosdash.ingestor.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

/**
 * Normalized OSDR dataset keyed by {@code datasetId}. Re-ingesting the same
 * dataset updates title, status, updatedAt and raw in place; id and createdAt
 * never change.
 *
 * @param updatedAt  last upstream modification time, null when the source omits it
 * @param insertedAt time of the most recent ingestion
 */
public record CatalogItem(
        UUID id,
        String datasetId,
        String title,
        String status,
        Instant updatedAt,
        Instant insertedAt,
        JsonNode raw,
        Instant createdAt
) {

    public boolean hasNaturalKey() {
        return datasetId != null && !datasetId.isBlank();
    }
}
