package com.example.inventorytasks.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * One WebClient per remote API, each with its own base URL and timeout.
 */
@Slf4j
@Configuration
public class WebClientConfig {

    @Value("${spring.application.name:inventory-task-service}")
    private String applicationName;

    @Bean(name = "exchangeRateWebClient")
    public WebClient exchangeRateWebClient(WebClient.Builder builder, ExchangeRateProperties properties) {
        return remoteApi(builder, "exchange-rates", properties.getProviderBaseUrl(),
                Duration.ofSeconds(properties.getTimeoutSeconds()))
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Bean(name = "releaseWebClient")
    public WebClient releaseWebClient(WebClient.Builder builder, ReleaseCheckProperties properties) {
        return remoteApi(builder, "releases", properties.getBaseUrl(),
                Duration.ofSeconds(properties.getTimeoutSeconds()))
                .defaultHeader(HttpHeaders.ACCEPT, "application/vnd.github+json")
                .build();
    }

    private WebClient.Builder remoteApi(WebClient.Builder builder, String name, String baseUrl, Duration timeout) {
        var httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeout.toMillis())
                .responseTimeout(timeout)
                .doOnConnected(connection ->
                        connection.addHandlerLast(new ReadTimeoutHandler(timeout.toMillis(), TimeUnit.MILLISECONDS)));

        log.info("Remote API '{}' at {} (timeout {})", name, baseUrl, timeout);
        return builder.clone()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.USER_AGENT, applicationName)
                .filter(logExchange(name));
    }

    private static ExchangeFilterFunction logExchange(String name) {
        return (request, next) -> {
            var startedAt = System.nanoTime();
            log.debug("[{}] {} {}", name, request.method(), request.url());
            return next.exchange(request).doOnNext(response -> {
                var tookMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
                if (response.statusCode().isError()) {
                    log.warn("[{}] {} {} answered {} after {}ms", name, request.method(), request.url(), response.statusCode(), tookMs);
                } else {
                    log.debug("[{}] {} after {}ms", name, response.statusCode(), tookMs);
                }
            });
        };
    }
}
