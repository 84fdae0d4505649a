package com.example.media_acquisition.engine;

import com.example.media_acquisition.config.RecognitionProperties;
import com.example.media_acquisition.dto.TrackMatch;
import com.example.media_acquisition.engine.Interfaces.RecognitionEngine;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.FileSystemResource;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Acoustic fingerprint lookup against the AudD recognition API.
 */
@Component
public class AuddRecognitionEngine implements RecognitionEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(AuddRecognitionEngine.class);

    private final WebClient client;
    private final ObjectMapper objectMapper;
    private final String apiToken;
    private final Duration timeout;

    public AuddRecognitionEngine(@Qualifier("recognitionWebClient") WebClient client,
                                 ObjectMapper objectMapper,
                                 RecognitionProperties props) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.apiToken = props.getApiToken();
        this.timeout = Duration.ofSeconds(props.getTimeoutSeconds());
    }

    @Override
    public Optional<TrackMatch> recognize(Path audio) {
        var mb = new LinkedMultiValueMap<String, Object>();
        mb.add("file", new FileSystemResource(audio));
        if (apiToken != null && !apiToken.isBlank()) {
            mb.add("api_token", apiToken);
        }

        long start = System.currentTimeMillis();
        String payload = client.post()
                .uri("/")
                .body(BodyInserters.fromMultipartData(mb))
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .retryWhen(HttpRetries.transientFailures(LOGGER, "recognition " + audio.getFileName()))
                .block();
        LOGGER.debug("recognition {} answered in {} ms", audio.getFileName(), System.currentTimeMillis() - start);
        if (payload == null || payload.isBlank()) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (IOException e) {
            throw new UncheckedIOException("unparseable recognition response", e);
        }
        if (!"success".equals(root.path("status").asText())) {
            LOGGER.warn("recognition error response: {}", root.path("error").toString());
            return Optional.empty();
        }
        JsonNode result = root.path("result");
        String title = result.path("title").asText("");
        if (result.isMissingNode() || result.isNull() || title.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new TrackMatch(title, result.path("artist").asText("")));
    }
}
