package com.flagship.fuel_ledger.account;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Repository
public interface UserAccountRepository extends JpaRepository<UserAccountEntity, String> {

    @Modifying(clearAutomatically = true)
    @Query("UPDATE UserAccountEntity a SET a.monthlyLimit = :limit, a.updatedAt = :now WHERE a.username = :username")
    int updateMonthlyLimit(@Param("username") String username,
                           @Param("limit") BigDecimal limit,
                           @Param("now") Instant now);

    @Query("SELECT DISTINCT a.chatDestination FROM UserAccountEntity a ORDER BY a.chatDestination")
    List<String> findDistinctChatDestinations();
}
