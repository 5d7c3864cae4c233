package com.example.inventorytasks.client;

import com.example.inventorytasks.client.ClientModels.LatestRatesResponse;
import com.example.inventorytasks.config.ExchangeRateProperties;
import com.example.inventorytasks.exception.ExternalServiceException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Collection;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Client for a Frankfurter-compatible rate provider ({@code GET /latest?from=USD&to=EUR,GBP}).
 */
@Slf4j
@Component
public class ExchangeRateClient extends JsonApiClient {

    public ExchangeRateClient(@Qualifier("exchangeRateWebClient") WebClient webClient, ExchangeRateProperties properties) {
        super(webClient, "Exchange Rate Provider", Duration.ofSeconds(properties.getTimeoutSeconds()));
    }

    /**
     * Latest rates of {@code currencies} quoted against {@code baseCurrency}.
     * The base currency itself is not requested.
     *
     * @throws ExternalServiceException if the provider cannot be reached or answers without rates
     */
    @CircuitBreaker(name = "exchangeRateProvider", fallbackMethod = "circuitOpen")
    @Retry(name = "exchangeRateProvider")
    public LatestRatesResponse fetchLatestRates(String baseCurrency, Collection<String> currencies) {
        var symbols = currencies.stream()
                .map(c -> c.trim().toUpperCase(Locale.ROOT))
                .filter(c -> !c.equalsIgnoreCase(baseCurrency))
                .distinct()
                .collect(Collectors.joining(","));

        log.info("Fetching {} rates for {}", baseCurrency, symbols);

        var response = get(uri -> uri.path("/latest")
                .queryParam("from", baseCurrency)
                .queryParam("to", symbols)
                .build(), LatestRatesResponse.class);

        if (response.getRates() == null || response.getRates().isEmpty()) {
            throw ExternalServiceException.unavailable(service(), "Response contains no rates");
        }
        return response;
    }

    @SuppressWarnings("unused")
    private LatestRatesResponse circuitOpen(String baseCurrency, Collection<String> currencies, Exception e) {
        if (e instanceof ExternalServiceException) {
            throw (ExternalServiceException) e;
        }
        log.warn("Exchange rate provider unavailable for base {}: {}", baseCurrency, e.getMessage());
        throw ExternalServiceException.unavailable(service(), "Circuit breaker open", e);
    }
}
