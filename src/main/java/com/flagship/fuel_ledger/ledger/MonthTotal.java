package com.flagship.fuel_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Sum of one user's expenses for a month of a given year (month is 1..12).
 */
@Value
public class MonthTotal {
    int month;
    BigDecimal total;
}
