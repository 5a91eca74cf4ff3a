package com.cosmosdash.ingestor.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

/**
 * One raw ISS position document as fetched.
 */
public record PositionLog(
        UUID id,
        Instant fetchedAt,
        String sourceUrl,
        JsonNode payload,
        Instant createdAt
) {}
