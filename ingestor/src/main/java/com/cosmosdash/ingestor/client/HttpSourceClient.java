package com.cosmosdash.ingestor.client;

import com.cosmosdash.common.client.SourceClient;
import com.cosmosdash.common.exception.ConfigurationFailureException;
import com.cosmosdash.common.exception.FetchFailureException;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.URI;
import java.util.function.Supplier;

/**
 * GET one JSON document from an upstream API through its circuit breaker.
 * The request URI is rebuilt on every call so date-windowed queries stay current.
 */
@Slf4j
public class HttpSourceClient implements SourceClient {

    private final String name;
    private final String baseUrl;
    private final RestClient restClient;
    private final Supplier<URI> uriFactory;
    private final CircuitBreaker circuitBreaker;

    public HttpSourceClient(String name, String baseUrl, RestClient restClient,
                            Supplier<URI> uriFactory, CircuitBreaker circuitBreaker) {
        this.name = name;
        this.baseUrl = baseUrl;
        this.restClient = restClient;
        this.uriFactory = uriFactory;
        this.circuitBreaker = circuitBreaker;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String sourceUrl() {
        return baseUrl;
    }

    @Override
    public void validate() {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new ConfigurationFailureException(name, "source URL is not set");
        }
    }

    @Override
    public JsonNode fetch() {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new FetchFailureException(name, "source URL is not configured");
        }
        try {
            JsonNode body = circuitBreaker.executeSupplier(this::get);
            if (body == null || body.isNull() || body.isMissingNode()) {
                throw new FetchFailureException(name, "empty response body");
            }
            return body;
        } catch (CallNotPermittedException e) {
            throw new FetchFailureException(name, "circuit breaker open", e);
        } catch (RestClientResponseException e) {
            throw new FetchFailureException(name, "HTTP " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new FetchFailureException(name, e.getMessage(), e);
        }
    }

    private JsonNode get() {
        URI uri = uriFactory.get();
        log.debug("GET {}", uri.getHost() + uri.getPath());
        return restClient.get()
                .uri(uri)
                .retrieve()
                .body(JsonNode.class);
    }
}
