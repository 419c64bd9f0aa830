package com.flagship.fuel_ledger.period;

import lombok.Value;

import java.time.LocalDate;

/**
 * Inclusive calendar range covering exactly one month.
 */
@Value
public class MonthRange {
    LocalDate firstDay;
    LocalDate lastDay;

    public boolean contains(LocalDate date) {
        return !date.isBefore(firstDay) && !date.isAfter(lastDay);
    }
}
