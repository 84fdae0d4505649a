package com.example.media_acquisition.engine;

import com.example.media_acquisition.config.YouTubeApiProperties;
import com.example.media_acquisition.dto.SearchCandidate;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static com.example.media_acquisition.engine.AuddRecognitionEngineTest.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YouTubeDataApiClientTest {

    @Test
    void searchParsesVideoIdsAndSkipsChannels() {
        AtomicReference<URI> uri = new AtomicReference<>();
        ExchangeFunction exchange = request -> {
            uri.set(request.url());
            return Mono.just(json(HttpStatus.OK, """
                    {"items":[
                      {"id":{"kind":"youtube#video","videoId":"abc123"},
                       "snippet":{"title":"Artist - Track (Official Audio)","channelTitle":"ArtistVEVO","description":"From the album"}},
                      {"id":{"kind":"youtube#channel","channelId":"UCxyz"},
                       "snippet":{"title":"Artist","channelTitle":"Artist"}}
                    ]}
                    """));
        };

        List<SearchCandidate> results = client(exchange).search("artist track", 5, "key-1");

        assertThat(results).containsExactly(new SearchCandidate("abc123",
                "Artist - Track (Official Audio)", "ArtistVEVO", "From the album", null));
        assertThat(uri.get().getPath()).endsWith("/search");
        assertThat(uri.get().getQuery()).contains("maxResults=5").contains("key=key-1").contains("q=artist track");
    }

    @Test
    void videosDetailsReadsIsoDurations() {
        ExchangeFunction exchange = request -> Mono.just(json(HttpStatus.OK, """
                {"items":[
                  {"id":"abc123","snippet":{"title":"Track","channelTitle":"Artist"},"contentDetails":{"duration":"PT3M33S"}},
                  {"id":"def456","snippet":{"title":"Other","channelTitle":"Someone"},"contentDetails":{"duration":"P0D"}}
                ]}
                """));

        Map<String, SearchCandidate> details = client(exchange).videosDetails(List.of("abc123", "def456"), "key-1");

        assertThat(details.get("abc123").durationSeconds()).isEqualTo(213);
        assertThat(details.get("def456").durationSeconds()).isZero();
    }

    @Test
    void emptyIdListDoesNotCallTheApi() {
        ExchangeFunction exchange = request -> {
            throw new AssertionError("no request expected");
        };

        assertThat(client(exchange).videosDetails(List.of(), "key-1")).isEmpty();
    }

    @Test
    void quotaErrorsPropagateAsResponseExceptionsWithoutRetry() {
        AtomicInteger calls = new AtomicInteger();
        ExchangeFunction exchange = request -> {
            calls.incrementAndGet();
            return Mono.just(json(HttpStatus.FORBIDDEN, "{\"error\":{\"code\":403,\"message\":\"quotaExceeded\"}}"));
        };

        assertThatThrownBy(() -> client(exchange).search("q", 5, "key-1"))
                .isInstanceOf(WebClientResponseException.class)
                .satisfies(e -> assertThat(((WebClientResponseException) e).getStatusCode().value()).isEqualTo(403));
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void backendErrorIsRetried() {
        AtomicInteger calls = new AtomicInteger();
        ExchangeFunction exchange = request -> calls.incrementAndGet() < 3
                ? Mono.just(json(HttpStatus.INTERNAL_SERVER_ERROR, "{\"error\":{\"code\":500,\"message\":\"backendError\"}}"))
                : Mono.just(json(HttpStatus.OK, """
                        {"items":[{"id":"abc123","snippet":{"title":"Track"},"contentDetails":{"duration":"PT1M"}}]}
                        """));

        assertThat(client(exchange).videoDetails("abc123", "key-1"))
                .map(SearchCandidate::durationSeconds)
                .contains(60);
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void parseIsoDurationHandlesGarbage() {
        assertThat(YouTubeDataApiClient.parseIsoDuration("PT3M33S")).isEqualTo(213);
        assertThat(YouTubeDataApiClient.parseIsoDuration("PT1H2M")).isEqualTo(3720);
        assertThat(YouTubeDataApiClient.parseIsoDuration("3:33")).isNull();
        assertThat(YouTubeDataApiClient.parseIsoDuration(null)).isNull();
    }

    private static YouTubeDataApiClient client(ExchangeFunction exchange) {
        YouTubeApiProperties props = new YouTubeApiProperties();
        props.setTimeoutSeconds(5);
        WebClient webClient = WebClient.builder()
                .baseUrl("https://yt.test/youtube/v3")
                .exchangeFunction(exchange)
                .build();
        return new YouTubeDataApiClient(webClient, new ObjectMapper(), props);
    }
}
