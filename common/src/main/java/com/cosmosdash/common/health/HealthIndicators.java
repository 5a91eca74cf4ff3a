package com.cosmosdash.common.health;

import com.cosmosdash.common.lifecycle.LifecycleState;
import com.cosmosdash.common.lifecycle.Scheduler;
import com.cosmosdash.common.lifecycle.Worker;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicators for the cache, the durable store, upstream breakers and
 * the worker scheduler.
 */
public class HealthIndicators {

    private HealthIndicators() {}

    @Component("redisHealthIndicator")
    public static class RedisHealthIndicator implements HealthIndicator {

        private static final Logger log = LoggerFactory.getLogger(RedisHealthIndicator.class);
        private final RedisConnectionFactory connectionFactory;

        public RedisHealthIndicator(RedisConnectionFactory connectionFactory) {
            this.connectionFactory = connectionFactory;
        }

        @Override
        public Health health() {
            try (RedisConnection connection = connectionFactory.getConnection()) {
                return Health.up()
                        .withDetail("status", "connected")
                        .withDetail("ping", connection.ping())
                        .build();
            } catch (Exception e) {
                log.warn("Redis health check failed: {}", e.getMessage());
                // Reads fall back to the database, so a missing cache degrades rather than fails
                return Health.status("DEGRADED")
                        .withDetail("status", "disconnected")
                        .withDetail("error", String.valueOf(e.getMessage()))
                        .build();
            }
        }
    }

    @Component("databaseHealthIndicator")
    public static class DatabaseHealthIndicator implements HealthIndicator {

        private static final Logger log = LoggerFactory.getLogger(DatabaseHealthIndicator.class);
        private final DataSource dataSource;

        public DatabaseHealthIndicator(DataSource dataSource) {
            this.dataSource = dataSource;
        }

        @Override
        public Health health() {
            try (Connection conn = dataSource.getConnection()) {
                if (conn.isValid(5)) {
                    return Health.up()
                            .withDetail("status", "connected")
                            .withDetail("database", conn.getMetaData().getDatabaseProductName())
                            .build();
                }
                return Health.down().withDetail("status", "invalid").build();
            } catch (Exception e) {
                log.warn("Database health check failed: {}", e.getMessage());
                return Health.down()
                        .withDetail("status", "disconnected")
                        .withDetail("error", String.valueOf(e.getMessage()))
                        .build();
            }
        }
    }

    /**
     * Open breaker means that source is currently not being fetched.
     */
    @Component("upstreamHealthIndicator")
    public static class UpstreamHealthIndicator implements HealthIndicator {

        private final CircuitBreakerRegistry registry;

        public UpstreamHealthIndicator(CircuitBreakerRegistry registry) {
            this.registry = registry;
        }

        @Override
        public Health health() {
            Map<String, Object> details = new LinkedHashMap<>();
            boolean anyOpen = false;
            for (CircuitBreaker cb : registry.getAllCircuitBreakers()) {
                details.put(cb.getName(), Map.of(
                        "state", cb.getState().name(),
                        "failureRate", cb.getMetrics().getFailureRate()));
                anyOpen |= cb.getState() == CircuitBreaker.State.OPEN;
            }
            Health.Builder builder = anyOpen ? Health.status("DEGRADED") : Health.up();
            return builder.withDetails(details).build();
        }
    }

    @Component("schedulerHealthIndicator")
    public static class SchedulerHealthIndicator implements HealthIndicator {

        private final Scheduler scheduler;

        public SchedulerHealthIndicator(Scheduler scheduler) {
            this.scheduler = scheduler;
        }

        @Override
        public Health health() {
            Map<String, Object> workers = new LinkedHashMap<>();
            boolean allRunning = true;
            for (Worker worker : scheduler.workers()) {
                workers.put(worker.name(), worker.state().name());
                allRunning &= worker.state() == LifecycleState.RUNNING;
            }
            Health.Builder builder = scheduler.isRunning() && allRunning ? Health.up() : Health.outOfService();
            return builder
                    .withDetail("scheduler", scheduler.state().name())
                    .withDetail("workers", workers)
                    .build();
        }
    }
}
