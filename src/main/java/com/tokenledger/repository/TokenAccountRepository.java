package com.tokenledger.repository;

import com.tokenledger.domain.TokenAccount;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for {@link TokenAccount}.
 *
 * Two read paths:
 *
 * 1. findByUserId(String userId)
 *    No lock. Used for balance display and lazy-creation checks.
 *
 * 2. findByUserIdForUpdate(String userId)
 *    PESSIMISTIC_WRITE (SELECT ... FOR UPDATE). Every balance mutation goes
 *    through this so that two proposals for the same user are linearized:
 *      - Proposal A locks the account (balance = 300)
 *      - Proposal B tries to lock the same account → WAITS
 *      - A spends 200 (balance = 100) → COMMITS
 *      - B acquires the lock and validates against balance = 100
 *    Without the lock both would validate against 300 and overdraw.
 *    The lock wait is bounded by spring.jpa.properties.jakarta.persistence.lock.timeout.
 *
 * Creation relies on the unique index on user_id: a concurrent second insert
 * fails with DataIntegrityViolationException instead of creating a duplicate.
 *
 * No @Transactional here (service layer owns transaction boundaries).
 */
@Repository
public interface TokenAccountRepository extends JpaRepository<TokenAccount, Long> {

    Optional<TokenAccount> findByUserId(String userId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM TokenAccount a WHERE a.userId = :userId")
    Optional<TokenAccount> findByUserIdForUpdate(@Param("userId") String userId);
}
