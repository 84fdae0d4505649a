package com.example.media_acquisition.config;

import com.example.media_acquisition.service.credentials.CredentialPool;
import com.example.media_acquisition.service.credentials.CredentialRotator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

@Configuration
public class CredentialConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(CredentialConfig.class);

    @Bean
    public CredentialRotator credentialRotator(CredentialProperties properties, Clock clock) {
        List<CredentialPool> pools = new ArrayList<>();
        properties.getPools().forEach((name, pool) -> {
            CredentialPool built = new CredentialPool(name, pool.getSecrets(), pool.getQuotaLimit(), pool.getWindow(),
                    pool.isDegradeWhenSaturated(), clock.instant());
            LOGGER.info("credential pool {} loaded with {} credential(s), quota={} per {}", name,
                    built.getCredentials().size(), built.getQuotaLimit(), built.getWindow());
            pools.add(built);
        });
        return new CredentialRotator(pools, clock);
    }
}
