package com.flagship.fuel_ledger.ledger.exception;

/**
 * Input rejected before touching the store: non-positive amount or limit,
 * too many decimal places, blank username.
 */
public class InvalidInputException extends IllegalArgumentException {

    public InvalidInputException(String message) {
        super(message);
    }
}
