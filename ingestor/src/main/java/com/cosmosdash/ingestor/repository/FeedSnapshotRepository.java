package com.cosmosdash.ingestor.repository;

import com.cosmosdash.common.util.JsonUtils;
import com.cosmosdash.ingestor.model.FeedSnapshot;
import com.cosmosdash.ingestor.model.FeedSource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Whole-response snapshots of feed sources (APOD, NEO).
 */
@Repository
public class FeedSnapshotRepository {

    private static final RowMapper<FeedSnapshot> ROW_MAPPER = (rs, rowNum) -> new FeedSnapshot(
            rs.getObject("id", UUID.class),
            FeedSource.fromCode(rs.getString("source")),
            rs.getTimestamp("fetched_at").toInstant(),
            JsonUtils.parseTree(rs.getString("payload"))
    );

    private final JdbcTemplate jdbcTemplate;

    public FeedSnapshotRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public FeedSnapshot create(FeedSnapshot snapshot) {
        jdbcTemplate.update(FeedSnapshotSql.INSERT,
                snapshot.id(),
                snapshot.source().code(),
                Timestamp.from(snapshot.fetchedAt()),
                JsonUtils.toJson(snapshot.payload()));
        return snapshot;
    }

    public Optional<FeedSnapshot> findLatest(FeedSource source) {
        return jdbcTemplate.query(FeedSnapshotSql.FIND_LATEST, ROW_MAPPER, source.code()).stream().findFirst();
    }

    public List<FeedSnapshot> findBetween(FeedSource source, Instant from, Instant to) {
        return jdbcTemplate.query(FeedSnapshotSql.FIND_BETWEEN, ROW_MAPPER,
                source.code(), Timestamp.from(from), Timestamp.from(to));
    }
}
