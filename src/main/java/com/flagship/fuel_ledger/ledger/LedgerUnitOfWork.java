package com.flagship.fuel_ledger.ledger;

import java.util.function.Supplier;

/**
 * Scope for a read-decide-write sequence on one owner's ledger.
 *
 * Everything {@code work} does through the stores commits together or not at all.
 * Two units for the same owner never interleave: the second one observes the
 * first one's writes. Units for different owners run in parallel.
 */
public interface LedgerUnitOfWork {

    <T> T execute(String owner, Supplier<T> work);
}
