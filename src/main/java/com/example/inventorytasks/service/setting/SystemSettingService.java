package com.example.inventorytasks.service.setting;

import com.example.inventorytasks.config.ExchangeRateProperties;
import com.example.inventorytasks.domain.entity.SystemSetting;
import com.example.inventorytasks.domain.repository.SystemSettingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.Optional;

/**
 * Read and write access to global settings stored in the database.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SystemSettingService {

    private final SystemSettingRepository settingRepository;
    private final ExchangeRateProperties exchangeRateProperties;

    @Transactional(readOnly = true)
    public Optional<String> getValue(String key) {
        return settingRepository.findById(key)
                .map(SystemSetting::getValue)
                .filter(value -> !value.isBlank());
    }

    @Transactional
    public void setValue(String key, String value) {
        var setting = settingRepository.findById(key)
                .orElseGet(() -> SystemSetting.builder().key(key).build());
        setting.setValue(value);
        settingRepository.save(setting);
        log.debug("Setting {} updated", key);
    }

    /**
     * Base currency for exchange rates: the stored DEFAULT_CURRENCY setting,
     * or the configured fallback when none is stored.
     */
    @Transactional(readOnly = true)
    public String defaultCurrency() {
        return getValue(SystemSetting.DEFAULT_CURRENCY)
                .orElse(exchangeRateProperties.getBaseCurrency())
                .trim()
                .toUpperCase(Locale.ROOT);
    }
}
