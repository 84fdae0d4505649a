package com.example.media_acquisition.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
public class WebClientConfig {

    private static final String BROWSER_USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/124.0 Safari/537.36";

    @Bean("youtubeApiWebClient")
    public WebClient youtubeApiWebClient(WebClient.Builder builder, YouTubeApiProperties props) {
        return builder.clone()
                .baseUrl(props.getBaseUrl())
                .clientConnector(connector(Duration.ofSeconds(props.getTimeoutSeconds()), false))
                .exchangeStrategies(strategies(4))
                .build();
    }

    @Bean("apifyWebClient")
    public WebClient apifyWebClient(WebClient.Builder builder, ApifyProperties props) {
        return builder.clone()
                .baseUrl(props.getBaseUrl())
                .clientConnector(connector(Duration.ofSeconds(props.getRunTimeoutSeconds() + 10), false))
                .exchangeStrategies(strategies(16))
                .build();
    }

    @Bean("apifyDownloadWebClient")
    public WebClient apifyDownloadWebClient(WebClient.Builder builder, ApifyProperties props) {
        // CDN links redirect and reject non-browser agents
        return builder.clone()
                .clientConnector(connector(Duration.ofSeconds(props.getDownloadTimeoutSeconds()), true))
                .defaultHeader(HttpHeaders.USER_AGENT, BROWSER_USER_AGENT)
                .defaultHeader(HttpHeaders.ACCEPT_LANGUAGE, "en-US,en;q=0.9")
                .defaultHeader("Referer", "https://www.instagram.com/")
                .build();
    }

    @Bean("recognitionWebClient")
    public WebClient recognitionWebClient(WebClient.Builder builder, RecognitionProperties props) {
        return builder.clone()
                .baseUrl(props.getBaseUrl())
                .clientConnector(connector(Duration.ofSeconds(props.getTimeoutSeconds()), false))
                .exchangeStrategies(strategies(1))
                .build();
    }

    private static ReactorClientHttpConnector connector(Duration timeout, boolean followRedirects) {
        int seconds = (int) Math.max(1, timeout.getSeconds());
        HttpClient http = HttpClient.create()
                .followRedirect(followRedirects)
                .compress(true)
                .responseTimeout(timeout)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 15_000)
                .doOnConnected(conn -> conn.addHandlerLast(new ReadTimeoutHandler(seconds)));
        return new ReactorClientHttpConnector(http);
    }

    private static ExchangeStrategies strategies(int maxInMemoryMb) {
        return ExchangeStrategies.builder()
                .codecs(c -> c.defaultCodecs().maxInMemorySize(maxInMemoryMb * 1024 * 1024))
                .build();
    }
}
