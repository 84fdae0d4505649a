package com.example.media_acquisition.config;

import com.example.media_acquisition.service.Interfaces.DeliveryStore;
import com.example.media_acquisition.service.LocalDeliveryStore;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@EnableConfigurationProperties(StorageProperties.class)
@Configuration
public class StorageConfig {

    @Bean
    public DeliveryStore deliveryStore(StorageProperties properties) {
        Path base = Path.of(properties.getBaseDir());
        var store = new LocalDeliveryStore(base, properties.getDeliveryPrefix(), properties.getMaxFileSizeBytes());
        LoggerFactory.getLogger(StorageConfig.class)
                .info("Delivery store wired: base={}, prefix={}, maxBytes={}", base, properties.getDeliveryPrefix(),
                        properties.getMaxFileSizeBytes());
        return store;
    }
}
