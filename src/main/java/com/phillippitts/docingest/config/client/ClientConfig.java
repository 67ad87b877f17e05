package com.phillippitts.docingest.config.client;

import com.phillippitts.docingest.config.properties.ApiClientProperties;
import com.phillippitts.docingest.config.properties.IngestionProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * HTTP clients for the ingestion backend.
 *
 * <p>Two clients share base URL and credential but differ in read timeout: short calls use
 * {@code ingest.api.read-timeout-ms}; transfers may run up to the transfer timeout ceiling and
 * are cut earlier by the per-item deadline.
 */
@Configuration
public class ClientConfig {

    private static final Logger LOG = LogManager.getLogger(ClientConfig.class);

    private final ApiClientProperties apiProperties;

    public ClientConfig(ApiClientProperties apiProperties) {
        this.apiProperties = apiProperties;
    }

    @Bean(name = "apiRestClient")
    public RestClient apiRestClient(RestClient.Builder builder) {
        return configure(builder, Duration.ofMillis(apiProperties.getReadTimeoutMs()));
    }

    @Bean(name = "transferRestClient")
    public RestClient transferRestClient(RestClient.Builder builder, IngestionProperties ingestionProperties) {
        return configure(builder, Duration.ofMillis(ingestionProperties.getTransfer().getTimeoutCeilingMs()));
    }

    private RestClient configure(RestClient.Builder builder, Duration readTimeout) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(apiProperties.getConnectTimeoutMs()))
                .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(readTimeout);

        RestClient.Builder configured = builder.clone()
                .baseUrl(apiProperties.getBaseUrl())
                .requestFactory(factory);
        String token = apiProperties.getSessionToken();
        if (token != null && !token.isBlank()) {
            configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + token);
            LOG.debug("Session token configured for {}", apiProperties.getBaseUrl());
        }
        return configured.build();
    }
}
