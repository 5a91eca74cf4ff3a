package com.cosmosdash.ingestor.repository;

public final class TelemetrySql {
    private TelemetrySql() {
    }

    public static final String INSERT = """
            INSERT INTO telemetry_samples (id, recorded_at, voltage, temperature, source_file, created_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

    public static final String FIND_BETWEEN = """
            SELECT id, recorded_at, voltage, temperature, source_file, created_at
            FROM telemetry_samples
            WHERE recorded_at BETWEEN ? AND ?
            ORDER BY recorded_at DESC
            """;

    public static final String FIND_LATEST = """
            SELECT id, recorded_at, voltage, temperature, source_file, created_at
            FROM telemetry_samples
            ORDER BY recorded_at DESC
            LIMIT ?
            """;

    public static final String STATS = """
            SELECT COUNT(*) AS sample_count,
                   AVG(voltage) AS avg_voltage,
                   MIN(voltage) AS min_voltage,
                   MAX(voltage) AS max_voltage,
                   AVG(temperature) AS avg_temperature,
                   MIN(temperature) AS min_temperature,
                   MAX(temperature) AS max_temperature
            FROM telemetry_samples
            WHERE recorded_at BETWEEN ? AND ?
            """;

    public static final String DELETE_OLDER_THAN = "DELETE FROM telemetry_samples WHERE recorded_at < ?";

    public static final String COUNT = "SELECT COUNT(*) FROM telemetry_samples";
}
