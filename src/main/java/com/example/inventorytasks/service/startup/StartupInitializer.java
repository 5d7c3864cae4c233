package com.example.inventorytasks.service.startup;

import com.example.inventorytasks.config.RuntimeFlagsProperties;
import com.example.inventorytasks.service.currency.ExchangeRateRefreshGate;
import com.example.inventorytasks.service.plugin.PluginBootstrap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.stereotype.Component;

/**
 * Runs the one-off startup steps once all singletons exist and before the web
 * server accepts requests: job registration, the exchange rate check, then plugins.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInitializer implements SmartInitializingSingleton {

    private final DatabaseReadiness databaseReadiness;
    private final RuntimeFlagsProperties runtimeFlags;
    private final StartupJobRegistrar jobRegistrar;
    private final ExchangeRateRefreshGate exchangeRateRefreshGate;
    private final PluginBootstrap pluginBootstrap;

    @Override
    public void afterSingletonsInstantiated() {
        var context = createContext();
        log.info("Starting up: {}", context);

        jobRegistrar.registerStartupJobs(context);

        if (context.isTestMode()) {
            log.debug("Test mode, skipping exchange rate check");
        } else if (!context.getStoreState().isReady()) {
            log.info("Database is {}, skipping exchange rate check", context.getStoreState());
        } else {
            exchangeRateRefreshGate.maybeRefreshExchangeRates();
        }

        pluginBootstrap.loadPlugins(context);
    }

    InitializationContext createContext() {
        return InitializationContext.builder()
                .storeState(databaseReadiness.check())
                .importingData(runtimeFlags.isImportingData())
                .testMode(runtimeFlags.isTestMode())
                .migrationMode(runtimeFlags.isMigrationMode())
                .pluginsEnabled(runtimeFlags.isPluginsEnabled())
                .build();
    }
}
