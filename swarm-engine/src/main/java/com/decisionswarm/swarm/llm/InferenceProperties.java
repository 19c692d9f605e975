package com.decisionswarm.swarm.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Endpoint settings for the regional inference endpoints ({@code swarm.inference.*}).
 * The {@code regions} map is the only place a region name is turned into a URL.
 */
@Component
@ConfigurationProperties(prefix = "swarm.inference")
public class InferenceProperties {

    private String apiKey = "";
    private String apiVersion = "2023-06-01";
    private String model = "claude-sonnet-4-6";
    private int maxTokens = 2000;
    private String completionPath = "/v1/messages";
    private Duration connectTimeout = Duration.ofSeconds(5);
    private int maxConnections = 16;
    private Duration retryBackoff = Duration.ofMillis(500);
    private Map<String, String> regions = new LinkedHashMap<>();

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getApiVersion() {
        return apiVersion;
    }

    public void setApiVersion(String apiVersion) {
        this.apiVersion = apiVersion;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
        this.maxTokens = maxTokens;
    }

    public String getCompletionPath() {
        return completionPath;
    }

    public void setCompletionPath(String completionPath) {
        this.completionPath = completionPath;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    public void setMaxConnections(int maxConnections) {
        this.maxConnections = maxConnections;
    }

    public Duration getRetryBackoff() {
        return retryBackoff;
    }

    public void setRetryBackoff(Duration retryBackoff) {
        this.retryBackoff = retryBackoff;
    }

    public Map<String, String> getRegions() {
        return regions;
    }

    public void setRegions(Map<String, String> regions) {
        this.regions = regions;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    /** Base URL for {@code region}, or {@code null} when the region is not configured. */
    public String resolveEndpoint(String region) {
        return regions.get(region);
    }
}
