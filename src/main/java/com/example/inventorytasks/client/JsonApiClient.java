package com.example.inventorytasks.client;

import com.example.inventorytasks.exception.ExternalServiceException;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.function.Function;

/**
 * Blocking JSON GET over a configured {@link WebClient}. Every failure surfaces
 * as an {@link ExternalServiceException} carrying the service name, so the
 * Resilience4j annotations on subclasses see a single exception type.
 */
abstract class JsonApiClient {

    private final WebClient webClient;
    private final String service;
    private final Duration timeout;

    protected JsonApiClient(WebClient webClient, String service, Duration timeout) {
        this.webClient = webClient;
        this.service = service;
        this.timeout = timeout;
    }

    protected <T> T get(Function<UriBuilder, URI> uri, Class<T> type) {
        T body;
        try {
            body = webClient.get()
                    .uri(uri)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .flatMap(text -> Mono.error(ExternalServiceException.httpError(service, response.statusCode().value(), text))))
                    .bodyToMono(type)
                    .timeout(timeout)
                    .block();
        } catch (ExternalServiceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw ExternalServiceException.unavailable(service, e.getMessage(), e);
        }

        if (body == null) {
            throw ExternalServiceException.unavailable(service, "Empty response body");
        }
        return body;
    }

    protected String service() {
        return service;
    }
}
