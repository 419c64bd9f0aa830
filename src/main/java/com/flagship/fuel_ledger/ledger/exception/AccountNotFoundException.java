package com.flagship.fuel_ledger.ledger.exception;

import lombok.Getter;

/**
 * The user has not registered yet. Callers should send them to registration.
 */
@Getter
public class AccountNotFoundException extends RuntimeException {

    private final String username;

    public AccountNotFoundException(String username) {
        super("User not found: " + username);
        this.username = username;
    }
}
