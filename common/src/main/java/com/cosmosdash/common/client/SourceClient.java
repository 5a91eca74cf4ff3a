package com.cosmosdash.common.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One external data source, reduced to a single fetch.
 * Transient and permanent upstream errors are not distinguished; both are
 * retried by the normal tick cadence.
 */
public interface SourceClient {

    /**
     * Short identifier used in logs, metrics and circuit breaker names.
     */
    String name();

    /**
     * Where the data comes from, recorded with every persisted fetch.
     */
    String sourceUrl();

    /**
     * @throws com.cosmosdash.common.exception.FetchFailureException on any upstream failure
     */
    JsonNode fetch();

    /**
     * @throws com.cosmosdash.common.exception.ConfigurationFailureException when a required URL or
     *         credential is missing
     */
    void validate();
}
