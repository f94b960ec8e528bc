package com.example.commandservice.config;

import com.example.commandservice.client.DocumentGenerationClient;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;

import java.time.Duration;

/**
 * Resilience4j circuit breaker and retry for calls to the document generation service.
 *
 * Circuit breaker: opens at 50% failures over the last 10 calls (minimum 5), stays open 30s.
 * Retry: up to 3 attempts with exponential backoff, only where the request cannot have started
 * a generation (see {@link DocumentGenerationClient#isRetryable}).
 */
@Slf4j
@Configuration
public class ResilienceConfig {

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(
            @Value("${planner.generation.circuit-breaker.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${planner.generation.circuit-breaker.wait-in-open-seconds:30}") long waitInOpenSeconds) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(failureRateThreshold)
                .waitDurationInOpenState(Duration.ofSeconds(waitInOpenSeconds))
                .permittedNumberOfCallsInHalfOpenState(3)
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(10)
                .minimumNumberOfCalls(5)
                // generation is slow by nature; only hard failures count
                .recordExceptions(RestClientException.class)
                .ignoreExceptions(HttpClientErrorException.class)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);

        registry.circuitBreaker(DocumentGenerationClient.RESILIENCE_NAME).getEventPublisher()
                .onStateTransition(event ->
                        log.warn("Document generation circuit breaker state changed: FROM {} TO {}",
                                event.getStateTransition().getFromState(),
                                event.getStateTransition().getToState()))
                .onCallNotPermitted(event ->
                        log.error("Document generation call not permitted (circuit is OPEN)"));

        return registry;
    }

    @Bean
    public RetryRegistry retryRegistry(
            @Value("${planner.generation.retry.max-attempts:3}") int maxAttempts,
            @Value("${planner.generation.retry.initial-interval-ms:500}") long initialIntervalMs) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialIntervalMs, 2.0))
                .retryOnException(DocumentGenerationClient::isRetryable)
                .build();

        RetryRegistry registry = RetryRegistry.of(config);

        registry.retry(DocumentGenerationClient.RESILIENCE_NAME).getEventPublisher()
                .onRetry(event ->
                        log.warn("Document generation retry attempt #{}: {}",
                                event.getNumberOfRetryAttempts(),
                                event.getLastThrowable().getMessage()))
                .onError(event ->
                        log.error("Document generation failed after {} attempts",
                                event.getNumberOfRetryAttempts(),
                                event.getLastThrowable()));

        return registry;
    }
}
