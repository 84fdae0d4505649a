package com.example.media_acquisition.engine;

import com.example.media_acquisition.config.RecognitionProperties;
import com.example.media_acquisition.dto.TrackMatch;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AuddRecognitionEngineTest {

    @TempDir
    Path dir;

    @Test
    void successfulResponseYieldsTrack() throws IOException {
        AtomicReference<HttpMethod> method = new AtomicReference<>();
        ExchangeFunction exchange = request -> {
            method.set(request.method());
            return Mono.just(json(HttpStatus.OK,
                    "{\"status\":\"success\",\"result\":{\"artist\":\"Daft Punk\",\"title\":\"One More Time\",\"album\":\"Discovery\"}}"));
        };

        Optional<TrackMatch> match = engine(exchange).recognize(sample());

        assertThat(method.get()).isEqualTo(HttpMethod.POST);
        assertThat(match).contains(new TrackMatch("One More Time", "Daft Punk"));
    }

    @Test
    void successWithoutResultIsNoMatch() throws IOException {
        ExchangeFunction exchange = request -> Mono.just(json(HttpStatus.OK, "{\"status\":\"success\",\"result\":null}"));

        assertThat(engine(exchange).recognize(sample())).isEmpty();
    }

    @Test
    void errorStatusIsNoMatch() throws IOException {
        ExchangeFunction exchange = request -> Mono.just(json(HttpStatus.OK,
                "{\"status\":\"error\",\"error\":{\"error_code\":901,\"error_message\":\"limit reached\"}}"));

        assertThat(engine(exchange).recognize(sample())).isEmpty();
    }

    @Test
    void serverErrorIsRetriedWithBackoff() throws IOException {
        AtomicInteger calls = new AtomicInteger();
        ExchangeFunction exchange = request -> calls.incrementAndGet() == 1
                ? Mono.just(json(HttpStatus.SERVICE_UNAVAILABLE, "{}"))
                : Mono.just(json(HttpStatus.OK, "{\"status\":\"success\",\"result\":{\"artist\":\"Daft Punk\",\"title\":\"Aerodynamic\"}}"));

        Optional<TrackMatch> match = engine(exchange).recognize(sample());

        assertThat(match).contains(new TrackMatch("Aerodynamic", "Daft Punk"));
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void httpFailurePropagatesToTheCallerOnceRetriesRunOut() throws IOException {
        AtomicInteger calls = new AtomicInteger();
        ExchangeFunction exchange = request -> {
            calls.incrementAndGet();
            return Mono.just(json(HttpStatus.BAD_GATEWAY, "{}"));
        };
        Path sample = sample();

        WebClientResponseException error = assertThrows(WebClientResponseException.class,
                () -> engine(exchange).recognize(sample));

        assertThat(error.getStatusCode().value()).isEqualTo(502);
        assertThat(calls.get()).isEqualTo(1 + HttpRetries.RETRY_MAX_ATTEMPTS);
    }

    @Test
    void clientErrorIsNotRetried() throws IOException {
        AtomicInteger calls = new AtomicInteger();
        ExchangeFunction exchange = request -> {
            calls.incrementAndGet();
            return Mono.just(json(HttpStatus.UNAUTHORIZED, "{}"));
        };
        Path sample = sample();

        assertThrows(WebClientResponseException.class, () -> engine(exchange).recognize(sample));
        assertThat(calls.get()).isEqualTo(1);
    }

    static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }

    static AuddRecognitionEngine engine(ExchangeFunction exchange) {
        RecognitionProperties props = new RecognitionProperties();
        props.setApiToken("test-token");
        props.setTimeoutSeconds(5);
        WebClient client = WebClient.builder().exchangeFunction(exchange).build();
        return new AuddRecognitionEngine(client, new ObjectMapper(), props);
    }

    private Path sample() throws IOException {
        Path file = dir.resolve("clip.mp3");
        Files.write(file, new byte[2048]);
        return file;
    }
}
