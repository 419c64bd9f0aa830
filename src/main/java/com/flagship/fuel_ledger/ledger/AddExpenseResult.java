package com.flagship.fuel_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Result of {@link LedgerService#addExpense}. A rejection is a normal outcome, not an error.
 */
public interface AddExpenseResult {

    boolean isAccepted();

    /**
     * The expense was recorded. {@code remaining == limit - newTotal}.
     */
    @Value
    class Accepted implements AddExpenseResult {
        BigDecimal newTotal;
        BigDecimal remaining;

        @Override
        public boolean isAccepted() {
            return true;
        }
    }

    /**
     * The expense would exceed the limit; nothing was written.
     */
    @Value
    class Rejected implements AddExpenseResult {
        BigDecimal current;
        BigDecimal attempted;
        BigDecimal limit;

        @Override
        public boolean isAccepted() {
            return false;
        }
    }
}
