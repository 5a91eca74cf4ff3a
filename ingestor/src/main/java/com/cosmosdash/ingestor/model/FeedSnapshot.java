package com.cosmosdash.ingestor.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

public record FeedSnapshot(
        UUID id,
        FeedSource source,
        Instant fetchedAt,
        JsonNode payload
) {}
