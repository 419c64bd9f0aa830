package com.flagship.fuel_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.expense.accepted: expenses written under the limit
 * - ledger.expense.rejected: expenses refused by the limit policy
 * - ledger.account.registered: new registrations (repeats are not counted)
 * - ledger.storage.failure: store failures, tagged by operation
 * - ledger.expense.add.duration: time spent in addExpense, including lock waits
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter expensesAccepted;
    private final Counter expensesRejected;
    private final Counter accountsRegistered;

    private final Timer addExpenseTimer;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.expensesAccepted = Counter.builder("ledger.expense.accepted")
                .description("Number of expenses accepted under the monthly limit")
                .register(registry);

        this.expensesRejected = Counter.builder("ledger.expense.rejected")
                .description("Number of expenses rejected by the monthly limit")
                .register(registry);

        this.accountsRegistered = Counter.builder("ledger.account.registered")
                .description("Number of accounts created")
                .register(registry);

        this.addExpenseTimer = Timer.builder("ledger.expense.add.duration")
                .description("Time taken to add an expense")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void incrementExpensesAccepted() {
        expensesAccepted.increment();
    }

    public void incrementExpensesRejected() {
        expensesRejected.increment();
    }

    public void incrementAccountsRegistered() {
        accountsRegistered.increment();
    }

    public void recordAddExpenseDuration(Duration duration) {
        addExpenseTimer.record(duration);
    }

    /**
     * Records a storage failure. Operation names are fixed strings, so the tag stays low-cardinality.
     */
    public void recordStorageFailure(String operation) {
        registry.counter("ledger.storage.failure", "operation", operation).increment();
    }
}
