package com.example.media_acquisition.config;

import com.example.media_acquisition.engine.ApifyInstagramBackend;
import com.example.media_acquisition.engine.Interfaces.MediaBackend;
import com.example.media_acquisition.engine.YouTubeApiAssistedBackend;
import com.example.media_acquisition.engine.YouTubeDataApiClient;
import com.example.media_acquisition.engine.YtDlpBackend;
import com.example.media_acquisition.engine.YtDlpClient;
import com.example.media_acquisition.service.backend.BackendDescriptor;
import com.example.media_acquisition.service.backend.ErrorClassifiers;
import com.example.media_acquisition.util.BackendCapability;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

import static com.example.media_acquisition.util.MediaPlatform.INSTAGRAM;
import static com.example.media_acquisition.util.MediaPlatform.TIKTOK;
import static com.example.media_acquisition.util.MediaPlatform.YOUTUBE;

/**
 * Declares every backend with its place in the platform chain. Priorities, timeouts and the enabled
 * flag can be overridden per backend name under {@code backends.overrides}.
 */
@Configuration
public class BackendChainConfig {

    static final String APIFY_POOL = "apify";

    private static final Duration SHORT_FORM_TIMEOUT = Duration.ofSeconds(120);
    private static final Duration LONG_FORM_TIMEOUT = Duration.ofMinutes(5);

    @Bean
    public MediaBackend ytDlpInstagramBackend(YtDlpClient ytDlp) {
        BackendDescriptor descriptor = BackendDescriptor.of("ytdlp-instagram", INSTAGRAM, 10, SHORT_FORM_TIMEOUT,
                ErrorClassifiers.process(), BackendCapability.VIDEO);
        return new YtDlpBackend(descriptor, ytDlp, List.of("-f", "best[height<=1080]/best"), true);
    }

    @Bean
    public MediaBackend apifyInstagramBackend(@Qualifier("apifyWebClient") WebClient apiClient,
                                              @Qualifier("apifyDownloadWebClient") WebClient downloadClient,
                                              ObjectMapper objectMapper,
                                              ApifyProperties properties) {
        Duration timeout = Duration.ofSeconds(properties.getRunTimeoutSeconds() + properties.getDownloadTimeoutSeconds());
        BackendDescriptor descriptor = BackendDescriptor.of("apify-instagram", INSTAGRAM, 20, timeout,
                        ErrorClassifiers.http(), BackendCapability.VIDEO, BackendCapability.STORIES)
                .withCredentialPool(APIFY_POOL, 1);
        return new ApifyInstagramBackend(descriptor, apiClient, downloadClient, objectMapper, properties);
    }

    @Bean
    public MediaBackend ytDlpTikTokBackend(YtDlpClient ytDlp) {
        BackendDescriptor descriptor = BackendDescriptor.of("ytdlp-tiktok", TIKTOK, 10, SHORT_FORM_TIMEOUT,
                ErrorClassifiers.process(), BackendCapability.VIDEO);
        return new YtDlpBackend(descriptor, ytDlp, List.of("-f", "best"), false);
    }

    @Bean
    public MediaBackend ytDlpTikTokGenericBackend(YtDlpClient ytDlp) {
        BackendDescriptor descriptor = BackendDescriptor.of("ytdlp-tiktok-generic", TIKTOK, 20, SHORT_FORM_TIMEOUT,
                ErrorClassifiers.process(), BackendCapability.VIDEO);
        return new YtDlpBackend(descriptor, ytDlp,
                List.of("--extractor-args", "tiktok:api_hostname=api22-normal-c-useast2a.tiktokv.com"), false);
    }

    @Bean
    public MediaBackend youTubeApiAssistedBackend(YouTubeDataApiClient api, YtDlpClient ytDlp,
                                                  YouTubeApiProperties properties) {
        BackendDescriptor descriptor = BackendDescriptor.of("youtube-api-assisted", YOUTUBE, 10, LONG_FORM_TIMEOUT,
                        ErrorClassifiers.http(), BackendCapability.AUDIO, BackendCapability.VIDEO)
                .withCredentialPool(properties.getPool(), properties.getVideosListCost());
        return new YouTubeApiAssistedBackend(descriptor, api, ytDlp, List.of());
    }

    @Bean
    public MediaBackend ytDlpYouTubeEnhancedBackend(YtDlpClient ytDlp) {
        BackendDescriptor descriptor = BackendDescriptor.of("ytdlp-youtube-enhanced", YOUTUBE, 20, LONG_FORM_TIMEOUT,
                ErrorClassifiers.process(), BackendCapability.AUDIO, BackendCapability.VIDEO);
        return new YtDlpBackend(descriptor, ytDlp,
                List.of("--extractor-args", "youtube:player_client=android,web"), true);
    }

    @Bean
    public MediaBackend ytDlpYouTubeBasicBackend(YtDlpClient ytDlp) {
        BackendDescriptor descriptor = BackendDescriptor.of("ytdlp-youtube-basic", YOUTUBE, 30, LONG_FORM_TIMEOUT,
                ErrorClassifiers.process(), BackendCapability.AUDIO, BackendCapability.VIDEO);
        return new YtDlpBackend(descriptor, ytDlp, List.of(), false);
    }
}
