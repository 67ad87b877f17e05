package com.phillippitts.docingest.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the ingestion backend ({@code ingest.api.*}).
 */
@Validated
@ConfigurationProperties(prefix = "ingest.api")
public class ApiClientProperties {

    @NotBlank
    private String baseUrl = "http://localhost:5001";

    /** Bearer token sent on every call; empty means unauthenticated. */
    private String sessionToken = "";

    @Positive
    private int connectTimeoutMs = 5000;

    /** Read timeout for short calls (classify, status, list, delete). Transfers use their own deadline. */
    @Positive
    private int readTimeoutMs = 30_000;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getSessionToken() {
        return sessionToken;
    }

    public void setSessionToken(String sessionToken) {
        this.sessionToken = sessionToken;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public void setReadTimeoutMs(int readTimeoutMs) {
        this.readTimeoutMs = readTimeoutMs;
    }
}
