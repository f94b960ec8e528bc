package com.example.commandservice.config;

import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.util.concurrent.TimeUnit;

/**
 * Pooled HTTP client for outbound calls.
 */
@Configuration
public class RestTemplateConfig {

    @Bean
    public PoolingHttpClientConnectionManager poolingConnectionManager(
            @Value("${planner.generation.timeout-seconds:60}") int timeoutSeconds) {
        PoolingHttpClientConnectionManager cm = new PoolingHttpClientConnectionManager();
        cm.setMaxTotal(50);
        cm.setDefaultMaxPerRoute(20);

        ConnectionConfig connectionConfig = ConnectionConfig.custom()
            .setConnectTimeout(Timeout.ofSeconds(2))
            // notes generation can take tens of seconds
            .setSocketTimeout(Timeout.ofSeconds(timeoutSeconds))
            .setValidateAfterInactivity(Timeout.ofSeconds(5))
            .setTimeToLive(60, TimeUnit.SECONDS)
            .build();
        cm.setDefaultConnectionConfig(connectionConfig);

        return cm;
    }

    @Bean
    public CloseableHttpClient httpClient(PoolingHttpClientConnectionManager cm) {
        return HttpClients.custom()
            .setConnectionManager(cm)
            .evictIdleConnections(Timeout.ofSeconds(30))
            .evictExpiredConnections()
            .build();
    }

    @Bean(name = "generationRestTemplate")
    public RestTemplate generationRestTemplate(CloseableHttpClient httpClient) {
        HttpComponentsClientHttpRequestFactory factory =
            new HttpComponentsClientHttpRequestFactory(httpClient);
        factory.setConnectTimeout((int) TimeUnit.SECONDS.toMillis(2));
        factory.setConnectionRequestTimeout((int) TimeUnit.SECONDS.toMillis(2));
        return new RestTemplate(factory);
    }
}
