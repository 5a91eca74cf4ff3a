package com.cosmosdash.ingestor.config;

import com.cosmosdash.common.client.SourceClient;
import com.cosmosdash.ingestor.client.HttpSourceClient;
import com.cosmosdash.ingestor.client.SyntheticTelemetrySource;
import com.cosmosdash.ingestor.client.TelemetrySource;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.random.RandomGenerator;

/**
 * Upstream clients, one circuit breaker each.
 */
@Slf4j
@Configuration
public class SourceClientConfig {

    public static final String ISS = "iss-api";
    public static final String OSDR = "osdr-api";
    public static final String APOD = "apod-api";
    public static final String NEO = "neo-api";

    private final IngestorProperties.Sources sources;
    private final CircuitBreakerRegistry circuitBreakers;

    public SourceClientConfig(IngestorProperties properties, CircuitBreakerRegistry circuitBreakers) {
        this.sources = properties.sources();
        this.circuitBreakers = circuitBreakers;
        if (!sources.nasa().hasApiKey()) {
            log.warn("No NASA API key configured, APOD and NEO fall back to the rate-limited DEMO_KEY");
        }
    }

    @Bean
    public RestClient sourceRestClient() {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(sources.connectTimeout());
        factory.setReadTimeout(sources.readTimeout());
        return RestClient.builder()
                .requestFactory(factory)
                .defaultHeader("Accept", "application/json")
                .defaultHeader("User-Agent", "cosmos-sync-ingestor")
                .build();
    }

    @Bean
    public SourceClient issClient(RestClient sourceRestClient) {
        String url = sources.iss().url();
        return new HttpSourceClient(ISS, url, sourceRestClient, () -> URI.create(url),
                circuitBreakers.circuitBreaker(ISS));
    }

    @Bean
    public SourceClient osdrClient(RestClient sourceRestClient) {
        String url = sources.nasa().osdrUrl();
        return new HttpSourceClient(OSDR, url, sourceRestClient, () -> URI.create(url),
                circuitBreakers.circuitBreaker(OSDR));
    }

    @Bean
    public SourceClient apodClient(RestClient sourceRestClient) {
        IngestorProperties.NasaSource nasa = sources.nasa();
        return new HttpSourceClient(APOD, nasa.apodUrl(), sourceRestClient,
                () -> UriComponentsBuilder.fromHttpUrl(nasa.apodUrl())
                        .queryParam("api_key", nasa.effectiveApiKey())
                        .queryParam("thumbs", true)
                        .build(true)
                        .toUri(),
                circuitBreakers.circuitBreaker(APOD));
    }

    /**
     * NEO feed for the trailing window ending today (UTC).
     */
    @Bean
    public SourceClient neoClient(RestClient sourceRestClient, Clock clock) {
        IngestorProperties.NasaSource nasa = sources.nasa();
        return new HttpSourceClient(NEO, nasa.neoUrl(), sourceRestClient,
                () -> {
                    LocalDate end = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
                    return UriComponentsBuilder.fromHttpUrl(nasa.neoUrl())
                            .queryParam("start_date", end.minusDays(nasa.neoDays()))
                            .queryParam("end_date", end)
                            .queryParam("api_key", nasa.effectiveApiKey())
                            .build(true)
                            .toUri();
                },
                circuitBreakers.circuitBreaker(NEO));
    }

    @Bean
    public TelemetrySource telemetrySource(IngestorProperties properties) {
        return new SyntheticTelemetrySource(properties.telemetry().batchSize(), RandomGenerator.getDefault());
    }
}
