package com.example.inventorytasks.service.job.jobs;

import com.example.inventorytasks.service.currency.ExchangeRateUpdater;
import com.example.inventorytasks.service.job.JobHandler;
import com.example.inventorytasks.service.job.JobNames;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class UpdateExchangeRatesJob implements JobHandler {

    private final ExchangeRateUpdater exchangeRateUpdater;

    @Override
    public String getName() {
        return JobNames.UPDATE_EXCHANGE_RATES;
    }

    @Override
    public void run() {
        exchangeRateUpdater.update();
    }
}
