package com.flagship.fuel_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Current month spend against the limit. Invariant: remaining == limit - totalSpent.
 * Remaining goes negative if the limit was lowered below what is already spent.
 */
@Value
public class MonthlySummary {
    BigDecimal totalSpent;
    BigDecimal limit;
    BigDecimal remaining;
}
