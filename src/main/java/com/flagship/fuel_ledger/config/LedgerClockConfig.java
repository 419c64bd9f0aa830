package com.flagship.fuel_ledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Provides the clock the ledger uses to resolve "today".
 * Day boundaries follow the configured zone, not UTC.
 */
@Configuration
public class LedgerClockConfig {

    @Bean
    public Clock ledgerClock(FuelLedgerProperties properties) {
        return Clock.system(properties.ledger().zone());
    }
}
