package com.example.commandservice.client;

import com.example.commandservice.exception.WorkerException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.ConnectTimeoutException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.util.function.Supplier;

/**
 * Client for the external study-notes generation service.
 *
 * <p>Calls are wrapped by the "documentGeneration" circuit breaker and retry. Every failure
 * (transport, open circuit, or a {@code success=false} reply) surfaces as {@link WorkerException}.
 */
@Component
@Slf4j
public class DocumentGenerationClient {

    public static final String RESILIENCE_NAME = "documentGeneration";

    private final RestTemplate restTemplate;
    private final CircuitBreaker circuitBreaker;
    private final Retry retry;
    private final String endpoint;
    private final String apiKey;

    public DocumentGenerationClient(
            @Qualifier("generationRestTemplate") RestTemplate restTemplate,
            CircuitBreakerRegistry circuitBreakerRegistry,
            RetryRegistry retryRegistry,
            @Value("${planner.generation.base-url}") String baseUrl,
            @Value("${planner.generation.path:/functions/v1/generate-notes-orchestrator}") String path,
            @Value("${planner.generation.api-key:}") String apiKey) {
        this.restTemplate = restTemplate;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(RESILIENCE_NAME);
        this.retry = retryRegistry.retry(RESILIENCE_NAME);
        this.endpoint = baseUrl + path;
        this.apiKey = apiKey;
    }

    public GenerationResponse generate(GenerationRequest request) {
        log.debug("Requesting document generation: topic={}, depth={}", request.getTopic(), request.getDepthLevel());

        Supplier<GenerationResponse> call = () -> post(request);
        Supplier<GenerationResponse> decorated = Retry.decorateSupplier(retry,
                CircuitBreaker.decorateSupplier(circuitBreaker, call));

        GenerationResponse response;
        try {
            response = decorated.get();
        } catch (CallNotPermittedException e) {
            log.error("Document generation circuit is OPEN, call rejected");
            throw new WorkerException("Document generation service is unavailable", e);
        } catch (RestClientException e) {
            log.error("Document generation call failed: {}", e.getMessage(), e);
            throw new WorkerException("Document generation failed: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new WorkerException("Document generation returned an empty response");
        }
        if (!response.isSuccess()) {
            log.warn("Document generation reported failure: {}", response.getError());
            throw new WorkerException(response.getError() != null
                    ? response.getError()
                    : "Document generation failed");
        }
        log.info("Document generation completed: topic={}", request.getTopic());
        return response;
    }

    /**
     * A generation is not idempotent, so only failures where the request never reached the
     * generator are retried: refused or timed-out connects, unknown hosts and 503 replies.
     * Read timeouts are not retried; the first generation may still be running.
     */
    public static boolean isRetryable(Throwable failure) {
        if (failure instanceof HttpServerErrorException.ServiceUnavailable) {
            return true;
        }
        if (!(failure instanceof ResourceAccessException)) {
            return false;
        }
        for (Throwable cause = failure.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof ConnectException
                    || cause instanceof ConnectTimeoutException
                    || cause instanceof UnknownHostException) {
                return true;
            }
        }
        return false;
    }

    private GenerationResponse post(GenerationRequest request) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (apiKey != null && !apiKey.isBlank()) {
            headers.setBearerAuth(apiKey);
        }
        return restTemplate.postForObject(endpoint, new HttpEntity<>(request, headers), GenerationResponse.class);
    }
}
