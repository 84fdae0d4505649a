package com.example.media_acquisition.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "recognition")
public class RecognitionProperties {

    private String baseUrl = "https://api.audd.io";
    private String apiToken;
    private long timeoutSeconds = 30;
    private long minInputBytes = 1_000;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiToken() {
        return apiToken;
    }

    public void setApiToken(String apiToken) {
        this.apiToken = apiToken;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public long getMinInputBytes() {
        return minInputBytes;
    }

    public void setMinInputBytes(long minInputBytes) {
        this.minInputBytes = minInputBytes;
    }
}
