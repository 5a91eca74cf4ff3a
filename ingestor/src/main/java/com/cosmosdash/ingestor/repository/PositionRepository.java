package com.cosmosdash.ingestor.repository;

import com.cosmosdash.common.util.JsonUtils;
import com.cosmosdash.ingestor.model.PositionLog;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Raw ISS fetch history.
 */
@Repository
public class PositionRepository {

    private static final RowMapper<PositionLog> ROW_MAPPER = (rs, rowNum) -> new PositionLog(
            rs.getObject("id", UUID.class),
            rs.getTimestamp("fetched_at").toInstant(),
            rs.getString("source_url"),
            JsonUtils.parseTree(rs.getString("payload")),
            rs.getTimestamp("created_at").toInstant()
    );

    private final JdbcTemplate jdbcTemplate;

    public PositionRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public PositionLog create(PositionLog log) {
        jdbcTemplate.update(PositionSql.INSERT,
                log.id(),
                Timestamp.from(log.fetchedAt()),
                log.sourceUrl(),
                JsonUtils.toJson(log.payload()),
                Timestamp.from(log.createdAt()));
        return log;
    }

    public Optional<PositionLog> findLatest() {
        return findLatest(1).stream().findFirst();
    }

    /**
     * Most recent {@code limit} fetches, newest first.
     */
    public List<PositionLog> findLatest(int limit) {
        return jdbcTemplate.query(PositionSql.FIND_LATEST, ROW_MAPPER, limit);
    }

    public List<PositionLog> findSince(Instant since) {
        return jdbcTemplate.query(PositionSql.FIND_SINCE, ROW_MAPPER, Timestamp.from(since));
    }

    public List<PositionLog> findBetween(Instant from, Instant to) {
        return jdbcTemplate.query(PositionSql.FIND_BETWEEN, ROW_MAPPER, Timestamp.from(from), Timestamp.from(to));
    }

    public long count() {
        Long count = jdbcTemplate.queryForObject(PositionSql.COUNT, Long.class);
        return count != null ? count : 0;
    }
}
