package com.flagship.fuel_ledger.account;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Per-user configuration: identity, notification destination and monthly limit.
 */
public interface AccountStore {

    Optional<UserAccount> findByUsername(String username);

    /**
     * @return false if an account with the same username already exists; nothing is changed then
     */
    boolean create(UserAccount account);

    /**
     * @return false if no account has this username
     */
    boolean updateLimit(String username, BigDecimal newLimit);

    /**
     * Distinct notification destinations of all accounts.
     */
    List<String> allNotificationDestinations();
}
