package com.example.media_acquisition.engine;

import com.example.media_acquisition.config.YouTubeApiProperties;
import com.example.media_acquisition.dto.SearchCandidate;
import com.example.media_acquisition.exception.BackendException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Minimal YouTube Data API v3 client ({@code search.list} and {@code videos.list}). The API key is passed
 * per call so callers can rotate keys. 5xx answers are retried; HTTP errors then propagate as
 * {@code WebClientResponseException}.
 */
@Component
public class YouTubeDataApiClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(YouTubeDataApiClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public YouTubeDataApiClient(@Qualifier("youtubeApiWebClient") WebClient webClient,
                                ObjectMapper objectMapper,
                                YouTubeApiProperties properties) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.timeout = Duration.ofSeconds(properties.getTimeoutSeconds());
    }

    public Optional<SearchCandidate> videoDetails(String videoId, String apiKey) {
        return Optional.ofNullable(videosDetails(List.of(videoId), apiKey).get(videoId));
    }

    public Map<String, SearchCandidate> videosDetails(List<String> videoIds, String apiKey) {
        Map<String, SearchCandidate> byId = new LinkedHashMap<>();
        if (videoIds.isEmpty()) {
            return byId;
        }
        JsonNode root = get("/videos", Map.of(
                "part", "snippet,contentDetails",
                "id", String.join(",", videoIds),
                "key", apiKey));
        for (JsonNode item : root.path("items")) {
            String id = textOrNull(item, "id");
            if (id == null) {
                continue;
            }
            JsonNode snippet = item.path("snippet");
            byId.put(id, new SearchCandidate(id,
                    textOrNull(snippet, "title"),
                    textOrNull(snippet, "channelTitle"),
                    textOrNull(snippet, "description"),
                    parseIsoDuration(textOrNull(item.path("contentDetails"), "duration"))));
        }
        return byId;
    }

    /**
     * Runs {@code search.list} for music videos. Durations are not part of the search response.
     */
    public List<SearchCandidate> search(String query, int maxResults, String apiKey) {
        JsonNode root = get("/search", Map.of(
                "part", "snippet",
                "type", "video",
                "videoCategoryId", "10",
                "maxResults", String.valueOf(maxResults),
                "q", query,
                "key", apiKey));
        List<SearchCandidate> candidates = new ArrayList<>();
        for (JsonNode item : root.path("items")) {
            String id = textOrNull(item.path("id"), "videoId");
            if (id == null) {
                continue;
            }
            JsonNode snippet = item.path("snippet");
            candidates.add(new SearchCandidate(id,
                    textOrNull(snippet, "title"),
                    textOrNull(snippet, "channelTitle"),
                    textOrNull(snippet, "description"),
                    null));
        }
        return candidates;
    }

    private JsonNode get(String path, Map<String, String> params) {
        String payload = webClient.get()
                .uri(builder -> {
                    builder.path(path);
                    params.keySet().forEach(k -> builder.queryParam(k, "{" + k + "}"));
                    return builder.build(params);
                })
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .retryWhen(HttpRetries.transientFailures(LOGGER, "YouTube API " + path))
                .block();
        if (payload == null || payload.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(payload);
        } catch (IOException e) {
            throw new BackendException("YouTube API returned unparseable payload for " + path, e);
        }
    }

    static Integer parseIsoDuration(String iso) {
        if (iso == null) {
            return null;
        }
        try {
            return (int) Duration.parse(iso).getSeconds();
        } catch (DateTimeParseException e) {
            LOGGER.debug("unparseable ISO duration {}", iso);
            return null;
        }
    }

    private String textOrNull(JsonNode node, String field) {
        if (node == null || !node.hasNonNull(field)) {
            return null;
        }
        var value = node.get(field).asText();
        return value != null && !value.isBlank() ? value : null;
    }
}
