package com.cosmosdash.ingestor.repository;

public final class CatalogSql {
    private CatalogSql() {
    }

    private static final String COLUMNS = "id, dataset_id, title, status, updated_at, inserted_at, raw, created_at";

    /**
     * Natural-key upsert. On conflict only the mutable columns change, so id
     * and created_at survive. {@code xmax = 0} holds only for freshly inserted rows.
     */
    public static final String UPSERT = """
            INSERT INTO osdr_items (id, dataset_id, title, status, updated_at, inserted_at, raw, created_at)
            VALUES (?, ?, ?, ?, ?, ?, CAST(? AS JSONB), ?)
            ON CONFLICT (dataset_id)
            DO UPDATE SET
                title = EXCLUDED.title,
                status = EXCLUDED.status,
                updated_at = EXCLUDED.updated_at,
                inserted_at = EXCLUDED.inserted_at,
                raw = EXCLUDED.raw
            RETURNING (xmax = 0) AS inserted
            """;

    public static final String FIND_BY_ID = "SELECT " + COLUMNS + " FROM osdr_items WHERE id = ?";

    public static final String FIND_BY_DATASET_ID = "SELECT " + COLUMNS + " FROM osdr_items WHERE dataset_id = ?";

    public static final String FIND_PAGE = "SELECT " + COLUMNS + """
             FROM osdr_items
            ORDER BY updated_at DESC NULLS LAST, created_at DESC
            LIMIT ? OFFSET ?
            """;

    public static final String SEARCH = "SELECT " + COLUMNS + """
             FROM osdr_items
            WHERE title ILIKE ? OR dataset_id ILIKE ?
            ORDER BY updated_at DESC NULLS LAST, created_at DESC
            LIMIT ?
            """;

    public static final String COUNT = "SELECT COUNT(*) FROM osdr_items";
}
