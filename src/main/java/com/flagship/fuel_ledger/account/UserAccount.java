package com.flagship.fuel_ledger.account;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A registered ledger user.
 * {@code chatDestination} is an opaque address for notifications; the ledger never reads it.
 */
@Value
public class UserAccount {
    String username;
    String chatDestination;
    BigDecimal monthlyLimit;
}
