package com.flagship.fuel_ledger.account;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Account store on Spring Data JPA.
 *
 * Bridges the domain value (UserAccount) and the persistence entity (UserAccountEntity).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaAccountStore implements AccountStore {

    private final UserAccountRepository userAccountRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<UserAccount> findByUsername(String username) {
        return userAccountRepository.findById(username)
            .map(UserAccountEntity::toDomain);
    }

    /**
     * Not transactional itself: the existence check and the insert each run in
     * a repository transaction, or join the caller's one when it is open.
     * A failed insert counts as "already exists" only when the row is really
     * there afterwards (a lost insert race); any other integrity failure is rethrown.
     */
    @Override
    public boolean create(UserAccount account) {
        if (userAccountRepository.existsById(account.getUsername())) {
            return false;
        }
        try {
            userAccountRepository.saveAndFlush(UserAccountEntity.fromDomain(account));
            log.debug("Saved account {}", account.getUsername());
            return true;
        } catch (DataIntegrityViolationException e) {
            if (!userAccountRepository.existsById(account.getUsername())) {
                throw e;
            }
            log.debug("Account {} was created concurrently", account.getUsername());
            return false;
        }
    }

    @Override
    @Transactional
    public boolean updateLimit(String username, BigDecimal newLimit) {
        return userAccountRepository.updateMonthlyLimit(username, newLimit, Instant.now()) > 0;
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> allNotificationDestinations() {
        return userAccountRepository.findDistinctChatDestinations();
    }
}
