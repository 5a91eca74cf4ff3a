package com.cosmosdash.ingestor.client;

import com.cosmosdash.common.exception.ConfigurationFailureException;
import com.cosmosdash.common.exception.FetchFailureException;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.net.URI;

import static org.assertj.core.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class HttpSourceClientTest {

    private static final String URL = "https://api.example.test/v1/satellites/25544";

    private MockRestServiceServer server;
    private RestClient restClient;
    private CircuitBreaker circuitBreaker;

    @BeforeEach
    void setup() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        restClient = builder.build();
        circuitBreaker = CircuitBreaker.ofDefaults("iss-api");
    }

    private HttpSourceClient client(String url) {
        return new HttpSourceClient("iss-api", url, restClient, () -> URI.create(url), circuitBreaker);
    }

    @Test
    void fetch_ReturnsParsedBody() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("{\"latitude\":51.5,\"longitude\":-0.1}", MediaType.APPLICATION_JSON));

        JsonNode body = client(URL).fetch();

        assertThat(body.get("latitude").asDouble()).isEqualTo(51.5);
        server.verify();
    }

    @Test
    @DisplayName("non-2xx status becomes a fetch failure carrying the code")
    void fetch_ServerError_FetchFailure() {
        server.expect(requestTo(URL)).andRespond(withServiceUnavailable());

        assertThatThrownBy(() -> client(URL).fetch())
                .isInstanceOf(FetchFailureException.class)
                .hasMessageContaining("HTTP 503")
                .extracting("source").isEqualTo("iss-api");
    }

    @Test
    void fetch_EmptyBody_FetchFailure() {
        server.expect(requestTo(URL)).andRespond(withSuccess("", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client(URL).fetch())
                .isInstanceOf(FetchFailureException.class)
                .hasMessageContaining("empty response body");
    }

    @Test
    void fetch_InvalidJson_FetchFailure() {
        server.expect(requestTo(URL)).andRespond(withSuccess("{not json", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client(URL).fetch()).isInstanceOf(FetchFailureException.class);
    }

    @Test
    @DisplayName("open circuit fails fast without a request")
    void fetch_CircuitOpen_FetchFailure() {
        circuitBreaker.transitionToOpenState();

        assertThatThrownBy(() -> client(URL).fetch())
                .isInstanceOf(FetchFailureException.class)
                .hasMessageContaining("circuit breaker open");
        server.verify();
    }

    @Test
    void validate_BlankUrl_ConfigurationFailure() {
        assertThatThrownBy(() -> client(" ").validate())
                .isInstanceOf(ConfigurationFailureException.class)
                .extracting("errorCode").isEqualTo("CONFIG");
    }

    @Test
    void validate_UrlPresent_Passes() {
        assertThatCode(() -> client(URL).validate()).doesNotThrowAnyException();
    }
}
