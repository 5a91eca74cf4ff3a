package com.cosmosdash.ingestor.repository;

import com.cosmosdash.ingestor.model.TelemetrySample;
import com.cosmosdash.ingestor.model.TelemetryStats;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public class TelemetryRepository {

    private static final RowMapper<TelemetrySample> ROW_MAPPER = (rs, rowNum) -> new TelemetrySample(
            rs.getObject("id", UUID.class),
            rs.getTimestamp("recorded_at").toInstant(),
            rs.getDouble("voltage"),
            rs.getDouble("temperature"),
            rs.getString("source_file"),
            rs.getTimestamp("created_at").toInstant()
    );

    private final JdbcTemplate jdbcTemplate;

    public TelemetryRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Insert a whole generated batch atomically.
     *
     * @return rows inserted
     */
    @Transactional
    public int batchCreate(List<TelemetrySample> samples) {
        if (samples.isEmpty()) {
            return 0;
        }
        int[][] counts = jdbcTemplate.batchUpdate(TelemetrySql.INSERT, samples, 500, (ps, sample) -> {
            ps.setObject(1, sample.id());
            ps.setTimestamp(2, Timestamp.from(sample.recordedAt()));
            ps.setDouble(3, sample.voltage());
            ps.setDouble(4, sample.temperature());
            ps.setString(5, sample.sourceFile());
            ps.setTimestamp(6, Timestamp.from(sample.createdAt()));
        });
        return samples.size() - failedRows(counts);
    }

    public List<TelemetrySample> findBetween(Instant from, Instant to) {
        return jdbcTemplate.query(TelemetrySql.FIND_BETWEEN, ROW_MAPPER, Timestamp.from(from), Timestamp.from(to));
    }

    public List<TelemetrySample> findLatest(int limit) {
        return jdbcTemplate.query(TelemetrySql.FIND_LATEST, ROW_MAPPER, limit);
    }

    public TelemetryStats stats(Instant from, Instant to) {
        TelemetryStats stats = jdbcTemplate.queryForObject(TelemetrySql.STATS,
                (rs, rowNum) -> mapStats(rs), Timestamp.from(from), Timestamp.from(to));
        return stats != null ? stats : TelemetryStats.empty();
    }

    /**
     * Retention sweep.
     *
     * @return rows deleted
     */
    @Transactional
    public int deleteOlderThan(Instant cutoff) {
        return jdbcTemplate.update(TelemetrySql.DELETE_OLDER_THAN, Timestamp.from(cutoff));
    }

    public long count() {
        Long count = jdbcTemplate.queryForObject(TelemetrySql.COUNT, Long.class);
        return count != null ? count : 0;
    }

    private static TelemetryStats mapStats(ResultSet rs) throws SQLException {
        long count = rs.getLong("sample_count");
        if (count == 0) {
            return TelemetryStats.empty();
        }
        return new TelemetryStats(count,
                rs.getDouble("avg_voltage"),
                rs.getDouble("min_voltage"),
                rs.getDouble("max_voltage"),
                rs.getDouble("avg_temperature"),
                rs.getDouble("min_temperature"),
                rs.getDouble("max_temperature"));
    }

    private static int failedRows(int[][] counts) {
        int failed = 0;
        for (int[] chunk : counts) {
            for (int rows : chunk) {
                if (rows == 0) {
                    failed++;
                }
            }
        }
        return failed;
    }
}
