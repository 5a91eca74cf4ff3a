package com.cosmosdash.common.sync;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Micrometer meters for synchronization invocations, tagged by domain.
 */
public class SyncMetrics {

    private final MeterRegistry registry;

    public SyncMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordOutcome(SyncResult result) {
        Counter.builder("sync.invocations")
                .description("Synchronization invocations by outcome")
                .tag("domain", result.domain())
                .tag("outcome", result.outcome().name().toLowerCase())
                .register(registry)
                .increment();
        if (result.fetched()) {
            Timer.builder("sync.duration")
                    .description("Time from fetch start to lock set")
                    .tag("domain", result.domain())
                    .register(registry)
                    .record(result.elapsed());
            DistributionSummary.builder("sync.items")
                    .description("Items persisted per invocation")
                    .tag("domain", result.domain())
                    .register(registry)
                    .record(result.items());
        }
    }

    public void recordFetchFailure(String domain) {
        counter("sync.fetch.failures", domain).increment();
    }

    public void recordPersistFailure(String domain) {
        counter("sync.persist.failures", domain).increment();
    }

    public double fetchFailures(String domain) {
        return counter("sync.fetch.failures", domain).count();
    }

    public double persistFailures(String domain) {
        return counter("sync.persist.failures", domain).count();
    }

    private Counter counter(String name, String domain) {
        return Counter.builder(name).tag("domain", domain).register(registry);
    }
}
