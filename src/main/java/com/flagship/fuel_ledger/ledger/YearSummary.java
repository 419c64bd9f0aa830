package com.flagship.fuel_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Per-month totals of one year. Months without expenses are left out;
 * {@code grandTotal} is the sum of the listed months.
 */
@Value
public class YearSummary {
    int year;
    List<MonthEntry> months;
    BigDecimal grandTotal;

    @Value
    public static class MonthEntry {
        int month;
        String monthName;
        BigDecimal total;
    }
}
