package com.example.media_acquisition.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Sizes the pools that run acquisitions, secondary acquisitions and time-bounded backend attempts.
 */
@ConfigurationProperties(prefix = "executor")
public class ExecutorProperties {

    private int acquisitionThreads = 8;
    private int secondaryThreads = 4;
    private int backendThreads = 16;
    private int queueCapacity = 100;

    public int getAcquisitionThreads() {
        return acquisitionThreads;
    }

    public void setAcquisitionThreads(int acquisitionThreads) {
        this.acquisitionThreads = acquisitionThreads;
    }

    public int getSecondaryThreads() {
        return secondaryThreads;
    }

    public void setSecondaryThreads(int secondaryThreads) {
        this.secondaryThreads = secondaryThreads;
    }

    public int getBackendThreads() {
        return backendThreads;
    }

    public void setBackendThreads(int backendThreads) {
        this.backendThreads = backendThreads;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }
}
