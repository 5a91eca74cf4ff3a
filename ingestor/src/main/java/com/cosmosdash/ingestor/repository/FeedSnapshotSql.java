package com.cosmosdash.ingestor.repository;

public final class FeedSnapshotSql {
    private FeedSnapshotSql() {
    }

    public static final String INSERT = """
            INSERT INTO feed_snapshots (id, source, fetched_at, payload)
            VALUES (?, ?, ?, CAST(? AS JSONB))
            """;

    public static final String FIND_LATEST = """
            SELECT id, source, fetched_at, payload
            FROM feed_snapshots
            WHERE source = ?
            ORDER BY fetched_at DESC
            LIMIT 1
            """;

    public static final String FIND_BETWEEN = """
            SELECT id, source, fetched_at, payload
            FROM feed_snapshots
            WHERE source = ? AND fetched_at BETWEEN ? AND ?
            ORDER BY fetched_at DESC
            """;
}
