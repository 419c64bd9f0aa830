package com.flagship.fuel_ledger.account;

import com.flagship.fuel_ledger.config.FuelLedgerProperties;
import com.flagship.fuel_ledger.ledger.StorageGuard;
import com.flagship.fuel_ledger.ledger.exception.AccountNotFoundException;
import com.flagship.fuel_ledger.ledger.exception.InvalidInputException;
import com.flagship.fuel_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Registration and limit management.
 *
 * Registration is idempotent: the first call creates the account with the default
 * limit, later calls report ALREADY_EXISTS and change nothing, whatever
 * destination they pass.
 */
@Service
@Slf4j
public class AccountService {

    // Column sizes of user_accounts
    static final int MAX_USERNAME_LENGTH = 32;
    static final int MAX_DESTINATION_LENGTH = 64;
    static final BigDecimal MAX_LIMIT = new BigDecimal("99999999.99");

    private final AccountStore accountStore;
    private final StorageGuard storageGuard;
    private final LedgerMetrics metrics;
    private final BigDecimal defaultLimit;

    public AccountService(AccountStore accountStore,
                          StorageGuard storageGuard,
                          LedgerMetrics metrics,
                          FuelLedgerProperties properties) {
        this.accountStore = accountStore;
        this.storageGuard = storageGuard;
        this.metrics = metrics;
        this.defaultLimit = properties.ledger().defaultLimit();
    }

    /**
     * @param username unique user identifier
     * @param destination opaque notification address, stored only on first registration
     */
    public RegistrationResult register(String username, String destination) {
        requireUsername(username);
        if (destination == null || destination.isBlank()) {
            throw new InvalidInputException("Notification destination is required");
        }
        if (destination.length() > MAX_DESTINATION_LENGTH) {
            throw new InvalidInputException(
                "Notification destination must be at most " + MAX_DESTINATION_LENGTH + " characters");
        }

        boolean created = storageGuard.call("register",
            () -> accountStore.create(new UserAccount(username, destination, defaultLimit)));
        if (!created) {
            log.debug("User {} is already registered", username);
            return RegistrationResult.ALREADY_EXISTS;
        }

        metrics.incrementAccountsRegistered();
        log.info("Registered user {} with default limit {}", username, defaultLimit);
        return RegistrationResult.CREATED;
    }

    /**
     * @throws InvalidInputException if the limit is missing, not positive, above 99999999.99
     *         or has more than 2 decimals
     * @throws AccountNotFoundException if the user is not registered
     */
    public void updateLimit(String username, BigDecimal newLimit) {
        requireUsername(username);
        if (newLimit == null || newLimit.compareTo(BigDecimal.ZERO) <= 0) {
            throw new InvalidInputException("Limit must be a positive number, got: " + newLimit);
        }
        if (newLimit.stripTrailingZeros().scale() > 2) {
            throw new InvalidInputException("Limit must have at most 2 decimal places, got: " + newLimit);
        }
        if (newLimit.compareTo(MAX_LIMIT) > 0) {
            throw new InvalidInputException("Limit must not exceed " + MAX_LIMIT + ", got: " + newLimit);
        }

        boolean updated = storageGuard.call("update_limit", () -> accountStore.updateLimit(username, newLimit));
        if (!updated) {
            throw new AccountNotFoundException(username);
        }
        log.info("Updated monthly limit of {} to {}", username, newLimit);
    }

    public UserAccount getAccount(String username) {
        requireUsername(username);
        return storageGuard.call("get_account", () -> accountStore.findByUsername(username))
            .orElseThrow(() -> new AccountNotFoundException(username));
    }

    public List<String> notificationDestinations() {
        return storageGuard.call("notification_destinations", accountStore::allNotificationDestinations);
    }

    static void requireUsername(String username) {
        if (username == null || username.isBlank()) {
            throw new InvalidInputException("Username is required");
        }
        if (username.length() > MAX_USERNAME_LENGTH) {
            throw new InvalidInputException("Username must be at most " + MAX_USERNAME_LENGTH + " characters");
        }
    }
}
