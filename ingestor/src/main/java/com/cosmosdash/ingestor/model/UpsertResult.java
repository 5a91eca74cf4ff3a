package com.cosmosdash.ingestor.model;

/**
 * Per-batch counts from a natural-key upsert.
 */
public record UpsertResult(int inserted, int updated, int skipped) {

    public int written() {
        return inserted + updated;
    }
}
