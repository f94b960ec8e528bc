package com.example.commandservice.client;

import com.example.commandservice.exception.WorkerException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withBadRequest;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class DocumentGenerationClientTest {

    private static final String ENDPOINT = "http://generation.test/functions/v1/generate-notes-orchestrator";

    private MockRestServiceServer server;
    private DocumentGenerationClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        RetryRegistry retryRegistry = RetryRegistry.of(RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(Duration.ofMillis(10))
                .retryOnException(DocumentGenerationClient::isRetryable)
                .build());
        client = new DocumentGenerationClient(restTemplate, CircuitBreakerRegistry.ofDefaults(), retryRegistry,
                "http://generation.test", "/functions/v1/generate-notes-orchestrator", "service-key");
    }

    private static GenerationRequest request() {
        return GenerationRequest.builder()
                .topic("Photosynthesis")
                .depthLevel("standard")
                .build();
    }

    @Test
    void returnsGeneratedDocument() {
        server.expect(requestTo(ENDPOINT))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer service-key"))
                .andExpect(jsonPath("$.topic").value("Photosynthesis"))
                .andExpect(jsonPath("$.depthLevel").value("standard"))
                .andRespond(withSuccess("{\"success\": true, \"data\": {\"title\": \"Photosynthesis notes\"}}",
                        MediaType.APPLICATION_JSON));

        GenerationResponse response = client.generate(request());

        assertThat(response.getData().get("title").asText()).isEqualTo("Photosynthesis notes");
        server.verify();
    }

    @Test
    void reportedFailureBecomesWorkerError() {
        server.expect(requestTo(ENDPOINT))
                .andRespond(withSuccess("{\"success\": false, \"error\": \"Topic too vague\"}",
                        MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.generate(request()))
                .isInstanceOf(WorkerException.class)
                .hasMessage("Topic too vague");
    }

    @Test
    void unavailableServiceIsRetriedThenReported() {
        server.expect(ExpectedCount.times(2), requestTo(ENDPOINT))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> client.generate(request()))
                .isInstanceOf(WorkerException.class)
                .hasCauseInstanceOf(HttpServerErrorException.class);
        server.verify();
    }

    @Test
    void internalServerErrorIsNotRetried() {
        server.expect(ExpectedCount.once(), requestTo(ENDPOINT))
                .andRespond(withServerError());

        assertThatThrownBy(() -> client.generate(request()))
                .isInstanceOf(WorkerException.class)
                .hasCauseInstanceOf(HttpServerErrorException.class);
        server.verify();
    }

    @Test
    void refusedConnectionIsRetried() {
        server.expect(ExpectedCount.times(2), requestTo(ENDPOINT))
                .andRespond(request -> {
                    throw new ConnectException("Connection refused");
                });

        assertThatThrownBy(() -> client.generate(request()))
                .isInstanceOf(WorkerException.class)
                .hasCauseInstanceOf(ResourceAccessException.class);
        server.verify();
    }

    @Test
    void readTimeoutIsNotRetried() {
        server.expect(ExpectedCount.once(), requestTo(ENDPOINT))
                .andRespond(request -> {
                    throw new SocketTimeoutException("Read timed out");
                });

        assertThatThrownBy(() -> client.generate(request()))
                .isInstanceOf(WorkerException.class)
                .hasCauseInstanceOf(ResourceAccessException.class);
        server.verify();
    }

    @Test
    void clientErrorsAreNotRetried() {
        server.expect(ExpectedCount.once(), requestTo(ENDPOINT))
                .andRespond(withBadRequest());

        assertThatThrownBy(() -> client.generate(request()))
                .isInstanceOf(WorkerException.class);
        server.verify();
    }
}
