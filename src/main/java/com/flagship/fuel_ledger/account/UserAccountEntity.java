package com.flagship.fuel_ledger.account;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * JPA entity for user accounts.
 *
 * The username is assigned by the caller, so the entity tracks whether it is new
 * itself. Without that, save() would merge and silently overwrite an existing
 * account on re-registration.
 * Only the monthly limit is mutable, and only through a bulk update query.
 */
@Entity
@Table(name = "user_accounts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class UserAccountEntity implements Persistable<String> {

    @Id
    @Column(nullable = false, updatable = false, length = 32)
    private String username;

    @Column(name = "chat_destination", nullable = false, updatable = false, length = 64)
    private String chatDestination;

    @Column(name = "monthly_limit", nullable = false, precision = 10, scale = 2)
    private BigDecimal monthlyLimit;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Transient
    @Getter(AccessLevel.NONE)
    private boolean fresh;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PostPersist
    @PostLoad
    void markPersisted() {
        this.fresh = false;
    }

    static UserAccountEntity fromDomain(UserAccount account) {
        return new UserAccountEntity(
            account.getUsername(),
            account.getChatDestination(),
            account.getMonthlyLimit(),
            null, // createdAt - set by @PrePersist
            null, // updatedAt - set by @PrePersist
            true
        );
    }

    public UserAccount toDomain() {
        return new UserAccount(username, chatDestination, monthlyLimit);
    }

    @Override
    public String getId() {
        return username;
    }

    @Override
    public boolean isNew() {
        return fresh;
    }
}
