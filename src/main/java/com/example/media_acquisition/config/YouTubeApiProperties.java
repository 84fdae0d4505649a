package com.example.media_acquisition.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "youtube.api")
public class YouTubeApiProperties {

    private String baseUrl = "https://www.googleapis.com/youtube/v3";
    private String pool = "youtube";
    private long timeoutSeconds = 15;
    private int searchCost = 100;
    private int videosListCost = 1;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getPool() {
        return pool;
    }

    public void setPool(String pool) {
        this.pool = pool;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public int getSearchCost() {
        return searchCost;
    }

    public void setSearchCost(int searchCost) {
        this.searchCost = searchCost;
    }

    public int getVideosListCost() {
        return videosListCost;
    }

    public void setVideosListCost(int videosListCost) {
        this.videosListCost = videosListCost;
    }
}
