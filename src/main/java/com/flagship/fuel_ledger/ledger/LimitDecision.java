package com.flagship.fuel_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of {@link LimitPolicy#decide}.
 */
public interface LimitDecision {

    boolean isAccepted();

    /**
     * The expense fits under the limit.
     * {@code combinedAmount} is what the day's record should hold after the write.
     */
    @Value
    class Accepted implements LimitDecision {
        BigDecimal newTotal;
        BigDecimal combinedAmount;

        @Override
        public boolean isAccepted() {
            return true;
        }
    }

    /**
     * The expense would push the month over the limit.
     * {@code attempted} is the raw amount submitted, not the merged day amount.
     */
    @Value
    class Rejected implements LimitDecision {
        BigDecimal currentTotal;
        BigDecimal attempted;
        BigDecimal limit;

        @Override
        public boolean isAccepted() {
            return false;
        }
    }
}
