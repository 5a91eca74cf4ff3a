package com.cosmosdash.ingestor.repository;

public final class PositionSql {
    private PositionSql() {
    }

    public static final String INSERT = """
            INSERT INTO iss_fetch_log (id, fetched_at, source_url, payload, created_at)
            VALUES (?, ?, ?, CAST(? AS JSONB), ?)
            """;

    /**
     * Newest first; LIMIT bound as parameter.
     */
    public static final String FIND_LATEST = """
            SELECT id, fetched_at, source_url, payload, created_at
            FROM iss_fetch_log
            ORDER BY fetched_at DESC
            LIMIT ?
            """;

    public static final String FIND_SINCE = """
            SELECT id, fetched_at, source_url, payload, created_at
            FROM iss_fetch_log
            WHERE fetched_at >= ?
            ORDER BY fetched_at DESC
            """;

    public static final String FIND_BETWEEN = """
            SELECT id, fetched_at, source_url, payload, created_at
            FROM iss_fetch_log
            WHERE fetched_at BETWEEN ? AND ?
            ORDER BY fetched_at DESC
            """;

    public static final String COUNT = "SELECT COUNT(*) FROM iss_fetch_log";
}
