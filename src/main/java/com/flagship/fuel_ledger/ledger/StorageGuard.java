package com.flagship.fuel_ledger.ledger;

import com.flagship.fuel_ledger.ledger.exception.StorageException;
import com.flagship.fuel_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.util.function.Supplier;

/**
 * Turns persistence failures into {@link StorageException}.
 *
 * Covers connectivity, pool acquisition and transaction timeouts. Domain
 * exceptions thrown by the stores pass through untouched. Nothing is retried:
 * a timed-out write may still have committed.
 */
@Component
@Slf4j
public class StorageGuard {

    private final LedgerMetrics metrics;

    public StorageGuard(LedgerMetrics metrics) {
        this.metrics = metrics;
    }

    public <T> T call(String operation, Supplier<T> storeCall) {
        try {
            return storeCall.get();
        } catch (DataAccessException | TransactionException e) {
            log.error("Storage failure during {}", operation, e);
            metrics.recordStorageFailure(operation);
            throw new StorageException(operation, e);
        }
    }
}
