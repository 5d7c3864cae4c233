package com.example.inventorytasks.service.currency;

import com.example.inventorytasks.client.ExchangeRateClient;
import com.example.inventorytasks.config.ExchangeRateProperties;
import com.example.inventorytasks.domain.entity.ExchangeBackend;
import com.example.inventorytasks.domain.repository.ExchangeBackendRepository;
import com.example.inventorytasks.exception.ExternalServiceException;
import com.example.inventorytasks.service.setting.SystemSettingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;
import java.util.TreeMap;

/**
 * Fetches current exchange rates and stores them on the {@value #BACKEND_NAME} backend.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExchangeRateUpdater {

    public static final String BACKEND_NAME = "InventoryExchange";

    private final ExchangeRateClient exchangeRateClient;
    private final ExchangeBackendRepository backendRepository;
    private final SystemSettingService settingService;
    private final ExchangeRateProperties properties;

    /**
     * Replace all stored rates and stamp {@code last_update}. Runs in its own
     * transaction so a failure never poisons a caller's transaction.
     *
     * @return the backend as stored
     * @throws ExternalServiceException if the provider call fails or answers for another base currency
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ExchangeBackend update() {
        var baseCurrency = settingService.defaultCurrency();
        log.info("Updating exchange rates for base currency {}", baseCurrency);

        var response = exchangeRateClient.fetchLatestRates(baseCurrency, properties.getCurrencies());
        if (response.getBase() != null && !baseCurrency.equalsIgnoreCase(response.getBase())) {
            throw ExternalServiceException.invalidResponse("Exchange Rate Provider",
                    String.format("Rates quoted against %s, expected %s", response.getBase(), baseCurrency));
        }

        var rates = new TreeMap<String, BigDecimal>();
        rates.put(baseCurrency, BigDecimal.ONE);
        for (var currency : properties.getCurrencies()) {
            var code = currency.trim().toUpperCase(Locale.ROOT);
            var value = response.getRates().get(code);
            if (value != null) {
                rates.put(code, value);
            } else if (!code.equals(baseCurrency)) {
                log.warn("Provider returned no rate for {}", code);
            }
        }

        var backend = backendRepository.findById(BACKEND_NAME)
                .orElseGet(() -> ExchangeBackend.builder().name(BACKEND_NAME).build());
        backend.setBaseCurrency(baseCurrency);
        backend.setLastUpdate(Instant.now());
        backend.updateRates(rates);

        var saved = backendRepository.save(backend);
        log.info("Stored {} exchange rate(s) against {}", rates.size(), baseCurrency);
        return saved;
    }
}
