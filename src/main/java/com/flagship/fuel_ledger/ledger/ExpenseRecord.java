package com.flagship.fuel_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One user's fuel spend for one calendar day.
 *
 * Key invariant: at most one record per (owner, txDate). Same-day amounts
 * are merged into the existing record instead of creating another row.
 */
@Value
public class ExpenseRecord {
    long id;
    String owner;
    LocalDate txDate;
    BigDecimal amount;
}
