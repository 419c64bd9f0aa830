package com.flagship.fuel_ledger.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Typed configuration for the fuel ledger.
 *
 * <pre>
 * fuel:
 *   ledger:
 *     default-limit: 210.00
 *     zone-id: Europe/Madrid
 *     transaction-timeout: 5s
 *   release:
 *     version: 1.4.0
 *     change-description: Monthly summary now shows the remaining budget
 * </pre>
 */
@ConfigurationProperties(prefix = "fuel")
public record FuelLedgerProperties(
        @DefaultValue Ledger ledger,
        @DefaultValue Release release
) {

    public record Ledger(
            @DefaultValue("210.00") BigDecimal defaultLimit,
            @DefaultValue("Europe/Madrid") String zoneId,
            @DefaultValue("5s") Duration transactionTimeout
    ) {
        public Ledger {
            if (defaultLimit == null || defaultLimit.compareTo(BigDecimal.ZERO) <= 0) {
                throw new IllegalArgumentException("Default limit must be greater than 0, got: " + defaultLimit);
            }
            if (defaultLimit.stripTrailingZeros().scale() > 2) {
                throw new IllegalArgumentException("Default limit must have at most 2 decimal places, got: " + defaultLimit);
            }
            if (defaultLimit.compareTo(new BigDecimal("99999999.99")) > 0) {
                throw new IllegalArgumentException("Default limit must not exceed 99999999.99, got: " + defaultLimit);
            }
            if (zoneId == null || zoneId.isBlank()) {
                throw new IllegalArgumentException("zone-id must be provided");
            }
            try {
                ZoneId.of(zoneId);
            } catch (DateTimeException e) {
                throw new IllegalArgumentException("zone-id is not a valid time zone: " + zoneId, e);
            }
            if (transactionTimeout == null || transactionTimeout.isNegative() || transactionTimeout.isZero()) {
                throw new IllegalArgumentException("transaction-timeout must be positive");
            }
        }

        public ZoneId zone() {
            return ZoneId.of(zoneId);
        }
    }

    public record Release(
            String version,
            String changeDescription
    ) {
    }
}
