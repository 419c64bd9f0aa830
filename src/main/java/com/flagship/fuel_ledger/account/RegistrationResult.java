package com.flagship.fuel_ledger.account;

/**
 * Outcome of {@link AccountService#register}. Repeating a registration is not an error.
 */
public enum RegistrationResult {
    CREATED,
    ALREADY_EXISTS
}
