package com.cosmosdash.ingestor.repository;

import com.cosmosdash.common.util.JsonUtils;
import com.cosmosdash.ingestor.model.CatalogItem;
import com.cosmosdash.ingestor.model.UpsertResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * OSDR datasets, deduplicated by dataset id.
 */
@Slf4j
@Repository
public class CatalogRepository {

    private static final RowMapper<CatalogItem> ROW_MAPPER = (rs, rowNum) -> {
        Timestamp updatedAt = rs.getTimestamp("updated_at");
        return new CatalogItem(
                rs.getObject("id", UUID.class),
                rs.getString("dataset_id"),
                rs.getString("title"),
                rs.getString("status"),
                updatedAt != null ? updatedAt.toInstant() : null,
                rs.getTimestamp("inserted_at").toInstant(),
                JsonUtils.parseTree(rs.getString("raw")),
                rs.getTimestamp("created_at").toInstant()
        );
    };

    private final JdbcTemplate jdbcTemplate;

    public CatalogRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Upsert the whole batch in one transaction. Items without a dataset id
     * are skipped; any database error rolls back every row of the batch.
     */
    @Transactional
    public UpsertResult upsertAll(List<CatalogItem> items) {
        int inserted = 0;
        int updated = 0;
        int skipped = 0;
        for (CatalogItem item : items) {
            if (!item.hasNaturalKey()) {
                skipped++;
                continue;
            }
            Boolean fresh = jdbcTemplate.queryForObject(CatalogSql.UPSERT, Boolean.class,
                    item.id() != null ? item.id() : UUID.randomUUID(),
                    item.datasetId(),
                    nullToEmpty(item.title()),
                    nullToEmpty(item.status()),
                    item.updatedAt() != null ? Timestamp.from(item.updatedAt()) : null,
                    Timestamp.from(item.insertedAt()),
                    JsonUtils.toJson(item.raw()),
                    Timestamp.from(item.createdAt() != null ? item.createdAt() : item.insertedAt()));
            if (Boolean.TRUE.equals(fresh)) {
                inserted++;
            } else {
                updated++;
            }
        }
        if (skipped > 0) {
            log.warn("Skipped {} catalog item(s) without a dataset id", skipped);
        }
        return new UpsertResult(inserted, updated, skipped);
    }

    public Optional<CatalogItem> findById(UUID id) {
        return jdbcTemplate.query(CatalogSql.FIND_BY_ID, ROW_MAPPER, id).stream().findFirst();
    }

    public Optional<CatalogItem> findByDatasetId(String datasetId) {
        return jdbcTemplate.query(CatalogSql.FIND_BY_DATASET_ID, ROW_MAPPER, datasetId).stream().findFirst();
    }

    /**
     * @param page 1-based page number
     */
    public List<CatalogItem> findPage(int page, int limit) {
        return jdbcTemplate.query(CatalogSql.FIND_PAGE, ROW_MAPPER, limit, (page - 1) * limit);
    }

    public List<CatalogItem> search(String query, int limit) {
        String pattern = "%" + query + "%";
        return jdbcTemplate.query(CatalogSql.SEARCH, ROW_MAPPER, pattern, pattern, limit);
    }

    public long count() {
        Long count = jdbcTemplate.queryForObject(CatalogSql.COUNT, Long.class);
        return count != null ? count : 0;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
