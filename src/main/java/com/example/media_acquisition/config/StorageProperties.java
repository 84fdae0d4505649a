package com.example.media_acquisition.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "storage.local")
public class StorageProperties {
    private String baseDir = "./data";
    private String deliveryPrefix = "delivery";
    private long maxFileSizeBytes = 50L * 1024 * 1024;

    public String getBaseDir() { return baseDir; }
    public void setBaseDir(String baseDir) { this.baseDir = baseDir; }

    public String getDeliveryPrefix() { return deliveryPrefix; }
    public void setDeliveryPrefix(String deliveryPrefix) { this.deliveryPrefix = deliveryPrefix; }

    public long getMaxFileSizeBytes() { return maxFileSizeBytes; }
    public void setMaxFileSizeBytes(long maxFileSizeBytes) { this.maxFileSizeBytes = maxFileSizeBytes; }
}
