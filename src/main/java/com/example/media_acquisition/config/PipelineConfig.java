package com.example.media_acquisition.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables the pipeline's configuration properties.
 */
@Configuration
@EnableConfigurationProperties({
        PipelineProperties.class,
        ToolProperties.class,
        CredentialProperties.class,
        BackendProperties.class,
        RecognitionProperties.class,
        ApifyProperties.class,
        YouTubeApiProperties.class,
        ExecutorProperties.class
})
public class PipelineConfig {
}
