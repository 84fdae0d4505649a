package com.example.media_acquisition.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Top-level knobs of the acquisition pipeline.
 */
@Validated
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    @NotNull
    private Duration timeout = Duration.ofMinutes(5);
    private String workDir = "./data/work";
    private Recognition recognition = new Recognition();
    private Secondary secondary = new Secondary();
    /** Extra hosts per platform id, e.g. {@code instagram: [ig.example]}. */
    private Map<String, List<String>> hostAliases = new LinkedHashMap<>();

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public String getWorkDir() {
        return workDir;
    }

    public void setWorkDir(String workDir) {
        this.workDir = workDir;
    }

    public Recognition getRecognition() {
        return recognition;
    }

    public void setRecognition(Recognition recognition) {
        this.recognition = recognition;
    }

    public Secondary getSecondary() {
        return secondary;
    }

    public void setSecondary(Secondary secondary) {
        this.secondary = secondary;
    }

    public Map<String, List<String>> getHostAliases() {
        return hostAliases;
    }

    public void setHostAliases(Map<String, List<String>> hostAliases) {
        this.hostAliases = hostAliases;
    }

    public static class Recognition {
        private boolean enabled = true;
        @Min(1)
        private int clipSeconds = 30;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getClipSeconds() {
            return clipSeconds;
        }

        public void setClipSeconds(int clipSeconds) {
            this.clipSeconds = clipSeconds;
        }
    }

    public static class Secondary {
        private boolean enabled = true;
        @Min(1)
        private int maxResults = 5;
        @Min(1)
        private int maxQueries = 3;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxResults() {
            return maxResults;
        }

        public void setMaxResults(int maxResults) {
            this.maxResults = maxResults;
        }

        public int getMaxQueries() {
            return maxQueries;
        }

        public void setMaxQueries(int maxQueries) {
            this.maxQueries = maxQueries;
        }
    }
}
