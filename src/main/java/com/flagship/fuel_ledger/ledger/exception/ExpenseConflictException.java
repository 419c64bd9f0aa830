package com.flagship.fuel_ledger.ledger.exception;

import java.time.LocalDate;

/**
 * A second record was about to be created for the same user and day.
 * The engine merges same-day amounts, so this indicates a bug.
 */
public class ExpenseConflictException extends IllegalStateException {

    public ExpenseConflictException(String owner, LocalDate txDate) {
        super(String.format("Expense record already exists for %s on %s", owner, txDate));
    }
}
