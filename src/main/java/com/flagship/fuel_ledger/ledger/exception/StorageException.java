package com.flagship.fuel_ledger.ledger.exception;

/**
 * Persistence failure (connectivity, timeout, unclassified constraint).
 *
 * The message never carries driver text; the cause is kept for logging only.
 */
public class StorageException extends RuntimeException {

    public StorageException(String operation, Throwable cause) {
        super("Storage operation failed: " + operation, cause);
    }
}
