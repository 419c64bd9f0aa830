package com.flagship.fuel_ledger.ledger.exception;

/**
 * An expense record expected by the engine is missing from the store.
 * Never expected under correct engine usage.
 */
public class ExpenseNotFoundException extends IllegalStateException {

    public ExpenseNotFoundException(long expenseId) {
        super("Expense record not found: " + expenseId);
    }
}
