package com.flagship.fuel_ledger.ledger;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Decides whether a new expense fits under the monthly limit.
 *
 * Pure function of its arguments. The limit is inclusive: a month that ends
 * exactly at the limit is accepted.
 */
@Component
public class LimitPolicy {

    /**
     * @param currentTotal month total before the new expense
     * @param existingAmountOnDate amount already recorded for the same day, or null if none
     * @param proposedAmount amount being added
     * @param limit monthly limit
     */
    public LimitDecision decide(BigDecimal currentTotal, BigDecimal existingAmountOnDate,
                                BigDecimal proposedAmount, BigDecimal limit) {
        Objects.requireNonNull(currentTotal, "currentTotal");
        Objects.requireNonNull(proposedAmount, "proposedAmount");
        Objects.requireNonNull(limit, "limit");

        BigDecimal existing = existingAmountOnDate != null ? existingAmountOnDate : BigDecimal.ZERO;

        // Same-day amounts accumulate; the old day amount is replaced by the merged one
        BigDecimal combined = existing.add(proposedAmount);
        BigDecimal newTotal = currentTotal.subtract(existing).add(combined);

        if (newTotal.compareTo(limit) <= 0) {
            return new LimitDecision.Accepted(newTotal, combined);
        }
        return new LimitDecision.Rejected(currentTotal, proposedAmount, limit);
    }
}
