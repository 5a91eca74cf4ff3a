package com.cosmosdash.common.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Circuit breakers guarding upstream sources. One breaker per source, created
 * lazily by name from the shared default.
 */
@Slf4j
@Configuration
public class ResilienceConfig {

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        // Upstreams are polled every few minutes at most, so windows are small
        CircuitBreakerConfig upstreamConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold(50)
                .slowCallRateThreshold(80)
                .slowCallDurationThreshold(Duration.ofSeconds(20))
                .waitDurationInOpenState(Duration.ofMinutes(5))
                .permittedNumberOfCallsInHalfOpenState(1)
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(6)
                .minimumNumberOfCalls(3)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(upstreamConfig);
        registry.getEventPublisher().onEntryAdded(added -> attachLogging(added.getAddedEntry()));
        return registry;
    }

    private static void attachLogging(CircuitBreaker breaker) {
        breaker.getEventPublisher()
                .onStateTransition(event ->
                        log.warn("Circuit breaker '{}' state transition: {} -> {}",
                                event.getCircuitBreakerName(),
                                event.getStateTransition().getFromState(),
                                event.getStateTransition().getToState()))
                .onFailureRateExceeded(event ->
                        log.error("Circuit breaker '{}' failure rate exceeded: {}%",
                                event.getCircuitBreakerName(),
                                event.getFailureRate()));
    }
}
