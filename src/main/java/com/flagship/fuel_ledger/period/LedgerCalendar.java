package com.flagship.fuel_ledger.period;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Resolves "today" and month boundaries for the ledger.
 *
 * The only state is the injected clock, whose zone decides where a day starts.
 * Months are never closed explicitly: a new month begins as soon as the clock
 * crosses into it, because every aggregate is computed from the record dates.
 */
@Component
public class LedgerCalendar {

    private final Clock clock;

    public LedgerCalendar(Clock clock) {
        this.clock = clock;
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    public YearMonth currentMonth() {
        return YearMonth.from(today());
    }

    /**
     * First and last day of the given month, both inclusive.
     *
     * @throws java.time.DateTimeException if year or month is outside the calendar range
     */
    public static MonthRange monthBounds(int year, int month) {
        YearMonth yearMonth = YearMonth.of(year, month);
        return new MonthRange(yearMonth.atDay(1), yearMonth.atEndOfMonth());
    }
}
