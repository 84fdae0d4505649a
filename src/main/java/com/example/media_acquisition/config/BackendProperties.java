package com.example.media_acquisition.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-backend overrides keyed by backend name ({@code backends.overrides.ytdlp-instagram.enabled=false}).
 */
@ConfigurationProperties(prefix = "backends")
public class BackendProperties {

    private int transientRetries = 1;
    private Duration transientBackoff = Duration.ofSeconds(1);
    private Map<String, BackendOverride> overrides = new LinkedHashMap<>();

    public int getTransientRetries() {
        return transientRetries;
    }

    public void setTransientRetries(int transientRetries) {
        this.transientRetries = transientRetries;
    }

    public Duration getTransientBackoff() {
        return transientBackoff;
    }

    public void setTransientBackoff(Duration transientBackoff) {
        this.transientBackoff = transientBackoff;
    }

    public Map<String, BackendOverride> getOverrides() {
        return overrides;
    }

    public void setOverrides(Map<String, BackendOverride> overrides) {
        this.overrides = overrides;
    }

    public BackendOverride overrideFor(String backend) {
        return overrides.getOrDefault(backend, new BackendOverride());
    }

    public static class BackendOverride {
        private boolean enabled = true;
        private Duration timeout;
        private Integer priority;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Integer getPriority() {
            return priority;
        }

        public void setPriority(Integer priority) {
            this.priority = priority;
        }
    }
}
