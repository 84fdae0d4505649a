package com.example.media_acquisition.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Credential pools read once at startup. Secrets are typically injected from the environment,
 * e.g. {@code credentials.pools.youtube.secrets=${YOUTUBE_API_KEYS:}}.
 */
@ConfigurationProperties(prefix = "credentials")
public class CredentialProperties {

    private Map<String, Pool> pools = new LinkedHashMap<>();

    public Map<String, Pool> getPools() {
        return pools;
    }

    public void setPools(Map<String, Pool> pools) {
        this.pools = pools;
    }

    public static class Pool {
        private List<String> secrets = new ArrayList<>();
        private int quotaLimit = 10_000;
        private Duration window = Duration.ofHours(24);
        private boolean degradeWhenSaturated = true;

        public List<String> getSecrets() {
            return secrets;
        }

        public void setSecrets(List<String> secrets) {
            this.secrets = secrets;
        }

        public int getQuotaLimit() {
            return quotaLimit;
        }

        public void setQuotaLimit(int quotaLimit) {
            this.quotaLimit = quotaLimit;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }

        public boolean isDegradeWhenSaturated() {
            return degradeWhenSaturated;
        }

        public void setDegradeWhenSaturated(boolean degradeWhenSaturated) {
            this.degradeWhenSaturated = degradeWhenSaturated;
        }
    }
}
