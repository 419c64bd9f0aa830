package com.flagship.fuel_ledger.ledger;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Persistent mapping of (owner, date) to expense amount.
 *
 * Implementations own durability and the one-row-per-owner-per-day constraint.
 * Month arguments are calendar months (1..12); ranges are inclusive of the
 * first and last day.
 */
public interface LedgerStore {

    Optional<ExpenseRecord> findByDate(String owner, LocalDate date);

    /**
     * @return id assigned to the new record
     * @throws com.flagship.fuel_ledger.ledger.exception.ExpenseConflictException
     *         if a record already exists for the owner and date
     */
    long create(String owner, LocalDate date, BigDecimal amount);

    /**
     * @throws com.flagship.fuel_ledger.ledger.exception.ExpenseNotFoundException if no record has this id
     */
    void updateAmount(long id, BigDecimal newAmount);

    /**
     * @return sum of the month's amounts, zero when the month has no records
     */
    BigDecimal monthlyTotal(String owner, int year, int month);

    /**
     * Records of the month ordered by date ascending, then id descending.
     */
    List<ExpenseRecord> findMonth(String owner, int year, int month);

    long deleteMonth(String owner, int year, int month);

    /**
     * Deletes the month's latest record (greatest date, then greatest id).
     */
    Optional<ExpenseRecord> deleteLatestInMonth(String owner, int year, int month);

    /**
     * Per-month totals of the year, months without records omitted, month ascending.
     */
    List<MonthTotal> yearTotals(String owner, int year);
}
