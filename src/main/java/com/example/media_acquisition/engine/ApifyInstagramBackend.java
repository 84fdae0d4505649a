package com.example.media_acquisition.engine;

import com.example.media_acquisition.config.ApifyProperties;
import com.example.media_acquisition.dto.FetchRequest;
import com.example.media_acquisition.dto.FetchedMedia;
import com.example.media_acquisition.engine.Interfaces.MediaBackend;
import com.example.media_acquisition.exception.BackendException;
import com.example.media_acquisition.service.backend.BackendDescriptor;
import com.example.media_acquisition.util.BackendErrorClass;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Instagram through hosted Apify scraper actors. Each actor is tried in turn with the leased token;
 * the first one that yields a video URL wins and the video is streamed to the work dir.
 */
public class ApifyInstagramBackend implements MediaBackend {
    private static final Logger LOGGER = LoggerFactory.getLogger(ApifyInstagramBackend.class);
    private static final List<String> VIDEO_URL_FIELDS = List.of("videoUrl", "video_url");
    private static final int MAX_TITLE_LENGTH = 100;

    private final BackendDescriptor descriptor;
    private final WebClient apiClient;
    private final WebClient downloadClient;
    private final ObjectMapper objectMapper;
    private final ApifyProperties properties;

    public ApifyInstagramBackend(BackendDescriptor descriptor, WebClient apiClient, WebClient downloadClient,
                                 ObjectMapper objectMapper, ApifyProperties properties) {
        this.descriptor = descriptor;
        this.apiClient = apiClient;
        this.downloadClient = downloadClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public BackendDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public FetchedMedia fetch(FetchRequest request) {
        if (request.credential() == null) {
            throw new BackendException(BackendErrorClass.POOL_EXHAUSTED, "No Apify token leased");
        }
        String lastReason = "no actors configured";
        for (String actor : properties.getActors()) {
            try {
                JsonNode item = runActor(actor, request);
                String videoUrl = videoUrlOf(item);
                if (videoUrl == null) {
                    lastReason = actor + " returned no video url";
                    LOGGER.warn("apify actor {} returned no video for {}", actor, request.ref().key());
                    continue;
                }
                Path target = request.workDir().resolve(YtDlpBackend.fileBaseName(request) + ".mp4");
                download(videoUrl, target);
                return new FetchedMedia(target, titleOf(item, request), durationOf(item), null);
            } catch (WebClientResponseException ex) {
                int status = ex.getStatusCode().value();
                if (status == 401 || status == 402 || status == 403 || status == 429) {
                    throw ex;
                }
                lastReason = actor + " HTTP " + status;
                LOGGER.warn("apify actor {} failed for {}: {}", actor, request.ref().key(), ex.getMessage());
            } catch (BackendException ex) {
                lastReason = actor + ": " + ex.getMessage();
                LOGGER.warn("apify actor {} failed for {}: {}", actor, request.ref().key(), ex.getMessage());
            }
        }
        throw new BackendException(BackendErrorClass.FATAL, "No Apify actor produced a video (" + lastReason + ")");
    }

    private JsonNode runActor(String actor, FetchRequest request) {
        Map<String, Object> input = Map.of(
                "directUrls", List.of(request.url()),
                "resultsType", "posts",
                "resultsLimit", 1);
        String payload = apiClient.post()
                .uri(builder -> builder.path("/acts/{actor}/run-sync-get-dataset-items")
                        .queryParam("token", "{token}")
                        .queryParam("timeout", "{timeout}")
                        .build(actor, request.credential(), properties.getRunTimeoutSeconds()))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(input)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofSeconds(properties.getRunTimeoutSeconds() + 10))
                .retryWhen(HttpRetries.transientFailures(LOGGER, "apify actor " + actor))
                .block();
        if (payload == null || payload.isBlank()) {
            throw new BackendException(BackendErrorClass.TRANSIENT, "empty dataset from " + actor);
        }
        try {
            JsonNode root = objectMapper.readTree(payload);
            JsonNode first = root.isArray() ? root.path(0) : root;
            if (first.isMissingNode() || first.isEmpty()) {
                throw new BackendException(BackendErrorClass.FATAL, "no dataset items from " + actor);
            }
            return first;
        } catch (IOException e) {
            throw new BackendException("unparseable dataset from " + actor, e);
        }
    }

    private void download(String videoUrl, Path target) {
        Path tmp = target.resolveSibling(target.getFileName().toString() + ".part");
        try {
            Files.createDirectories(target.getParent());
            Flux<DataBuffer> body = downloadClient.get()
                    .uri(URI.create(videoUrl))
                    .retrieve()
                    .bodyToFlux(DataBuffer.class);
            DataBufferUtils.write(body, tmp)
                    .timeout(Duration.ofSeconds(properties.getDownloadTimeoutSeconds()))
                    .retryWhen(HttpRetries.transientFailures(LOGGER, "apify video download"))
                    .block();
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (WebClientResponseException e) {
            // the CDN refusing the file says nothing about the Apify token
            int status = e.getStatusCode().value();
            BackendErrorClass classification = e.getStatusCode().is5xxServerError() || status == 429
                    ? BackendErrorClass.TRANSIENT : BackendErrorClass.FATAL;
            throw new BackendException(classification, "video download HTTP " + status, e);
        } catch (IOException e) {
            throw new BackendException(BackendErrorClass.TRANSIENT, "video download failed: " + e.getMessage(), e);
        } finally {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException e) {
                LOGGER.warn("Failed to delete partial download path={}", tmp, e);
            }
        }
    }

    private String videoUrlOf(JsonNode item) {
        for (String field : VIDEO_URL_FIELDS) {
            if (item.hasNonNull(field) && !item.get(field).asText().isBlank()) {
                return item.get(field).asText();
            }
        }
        return null;
    }

    private String titleOf(JsonNode item, FetchRequest request) {
        String caption = item.hasNonNull("caption") ? item.get("caption").asText().strip() : "";
        if (caption.isEmpty()) {
            return "Instagram " + request.ref().canonicalId();
        }
        String firstLine = caption.lines().findFirst().orElse(caption);
        return firstLine.length() > MAX_TITLE_LENGTH ? firstLine.substring(0, MAX_TITLE_LENGTH) : firstLine;
    }

    private Integer durationOf(JsonNode item) {
        if (!item.hasNonNull("videoDuration")) {
            return null;
        }
        return (int) Math.round(item.get("videoDuration").asDouble());
    }
}
