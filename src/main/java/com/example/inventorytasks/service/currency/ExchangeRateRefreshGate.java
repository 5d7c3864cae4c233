package com.example.inventorytasks.service.currency;

import com.example.inventorytasks.domain.repository.ExchangeBackendRepository;
import com.example.inventorytasks.exception.DataStoreErrors;
import com.example.inventorytasks.service.setting.SystemSettingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

/**
 * Startup check that refreshes exchange rates immediately when the stored ones
 * cannot be trusted, instead of waiting for the daily job.
 * <p>
 * A refresh is needed when the backend has never been stored, has never been
 * updated, or was updated for a different base currency than the one now configured.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExchangeRateRefreshGate {

    private final ExchangeBackendRepository backendRepository;
    private final SystemSettingService settingService;
    private final ExchangeRateUpdater exchangeRateUpdater;

    /**
     * Never throws.
     *
     * @return true if a refresh ran and succeeded
     */
    public boolean maybeRefreshExchangeRates() {
        boolean needsUpdate;
        try {
            needsUpdate = needsUpdate();
        } catch (DataAccessException | TransactionException e) {
            if (DataStoreErrors.isNotReady(e)) {
                log.info("Database not ready, skipping exchange rate check: {}", e.getMessage());
            } else {
                log.warn("Could not read exchange rate state, will check again on next startup: {}", e.getMessage());
            }
            return false;
        }

        if (!needsUpdate) {
            log.debug("Exchange rates are current");
            return false;
        }

        try {
            exchangeRateUpdater.update();
            log.info("Exchange rates refreshed at startup");
            return true;
        } catch (Exception e) {
            log.error("Error updating exchange rates: {}", e.getMessage(), e);
            return false;
        }
    }

    boolean needsUpdate() {
        var configured = settingService.defaultCurrency();
        var backend = backendRepository.findById(ExchangeRateUpdater.BACKEND_NAME);

        if (backend.isEmpty()) {
            log.info("Exchange backend {} not found, exchange rates need updating", ExchangeRateUpdater.BACKEND_NAME);
            return true;
        }
        if (backend.get().getLastUpdate() == null) {
            log.info("Exchange rates have never been updated");
            return true;
        }
        if (!configured.equalsIgnoreCase(backend.get().getBaseCurrency())) {
            log.info("Base currency changed from {} to {}, exchange rates need updating", backend.get().getBaseCurrency(), configured);
            return true;
        }
        return false;
    }
}
