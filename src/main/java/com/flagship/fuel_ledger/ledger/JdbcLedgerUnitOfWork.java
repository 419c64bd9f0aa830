package com.flagship.fuel_ledger.ledger;

import com.flagship.fuel_ledger.config.FuelLedgerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.function.Supplier;

/**
 * Database transaction per unit of work, serialized per owner.
 *
 * The owner's account row is locked with SELECT ... FOR UPDATE before the work
 * runs, so concurrent units for the same owner queue behind each other and
 * re-read committed totals. Units for other owners lock other rows.
 * The transaction timeout also bounds the lock wait and every statement.
 */
@Component
@Slf4j
public class JdbcLedgerUnitOfWork implements LedgerUnitOfWork {

    private final TransactionTemplate transactionTemplate;
    private final JdbcTemplate jdbcTemplate;

    public JdbcLedgerUnitOfWork(PlatformTransactionManager transactionManager,
                                JdbcTemplate jdbcTemplate,
                                FuelLedgerProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        this.transactionTemplate.setTimeout(toTimeoutSeconds(properties));
    }

    @Override
    public <T> T execute(String owner, Supplier<T> work) {
        return transactionTemplate.execute(status -> {
            lockOwner(owner);
            return work.get();
        });
    }

    private void lockOwner(String owner) {
        List<String> locked = jdbcTemplate.queryForList(
            "SELECT username FROM user_accounts WHERE username = ? FOR UPDATE",
            String.class,
            owner
        );
        if (locked.isEmpty()) {
            // Nothing to lock; the work itself reports the missing account
            log.debug("No account row to lock for {}", owner);
        }
    }

    private static int toTimeoutSeconds(FuelLedgerProperties properties) {
        long millis = properties.ledger().transactionTimeout().toMillis();
        return (int) Math.max(1, (millis + 999) / 1000);
    }
}
