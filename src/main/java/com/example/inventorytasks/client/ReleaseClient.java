package com.example.inventorytasks.client;

import com.example.inventorytasks.client.ClientModels.ReleaseResponse;
import com.example.inventorytasks.config.ReleaseCheckProperties;
import com.example.inventorytasks.exception.ExternalServiceException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Reads the latest published release of a GitHub repository.
 */
@Slf4j
@Component
public class ReleaseClient extends JsonApiClient {

    public ReleaseClient(@Qualifier("releaseWebClient") WebClient webClient, ReleaseCheckProperties properties) {
        super(webClient, "Release API", Duration.ofSeconds(properties.getTimeoutSeconds()));
    }

    /**
     * @param repository {@code owner/name}
     * @throws ExternalServiceException if the API fails or the release has no tag
     */
    @CircuitBreaker(name = "releaseApi")
    @Retry(name = "releaseApi")
    public ReleaseResponse fetchLatestRelease(String repository) {
        log.debug("Looking up latest release of {}", repository);

        var release = get(uri -> uri.path("/repos/" + repository + "/releases/latest").build(), ReleaseResponse.class);
        if (release.getTagName() == null || release.getTagName().isBlank()) {
            throw ExternalServiceException.invalidResponse(service(), "Latest release of " + repository + " has no tag");
        }
        return release;
    }
}
