package com.tokenledger.service;

import com.tokenledger.domain.AccountDelta;
import com.tokenledger.domain.TokenAccount;
import com.tokenledger.exception.AccountNotFoundException;
import com.tokenledger.repository.TokenAccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Account store: user id → current account, created lazily with the starting grant.
 *
 * Balance changes happen only through {@link #apply(String, AccountDelta)},
 * which TransactionProcessor calls inside its unit of work.
 */
@Service
@Transactional
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    private final TokenAccountRepository accountRepository;
    private final AccountProvisioner provisioner;
    private final Clock clock;

    public AccountService(TokenAccountRepository accountRepository,
                          AccountProvisioner provisioner,
                          Clock clock) {
        this.accountRepository = accountRepository;
        this.provisioner = provisioner;
        this.clock = clock;
    }

    /**
     * Return the user's account, creating it on first access.
     *
     * Runs outside any surrounding transaction: the lookup and the insert each
     * take and release their own connection, so a caller never holds one
     * pooled connection while waiting for another. Concurrent first accesses
     * create exactly one account: the losers of the insert race read the
     * winner's row.
     *
     * @param userId opaque user identifier
     * @return existing or newly created account (detached)
     * @throws IllegalArgumentException if userId is blank
     * @throws AccountNotFoundException if creation failed and no row is readable
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public TokenAccount getAccount(String userId) {
        validateUserId(userId);
        return accountRepository.findByUserId(userId)
                .orElseGet(() -> provision(userId));
    }

    /**
     * Return the user's account under a PESSIMISTIC_WRITE row lock. The lock
     * is held until the surrounding transaction ends.
     *
     * Does not create accounts; callers run {@link #getAccount(String)} before
     * opening their transaction.
     *
     * @throws AccountNotFoundException if the user has no account
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public TokenAccount lockAccount(String userId) {
        validateUserId(userId);
        return accountRepository.findByUserIdForUpdate(userId)
                .orElseThrow(() -> new AccountNotFoundException(userId));
    }

    /**
     * Apply a delta to the user's account.
     *
     * Must run inside the caller's transaction so the balance change and the
     * ledger entry commit together.
     *
     * @return the updated account
     * @throws IllegalStateException if the delta would break an accounting invariant
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public TokenAccount apply(String userId, AccountDelta delta) {
        TokenAccount account = accountRepository.findByUserIdForUpdate(userId)
                .orElseThrow(() -> new AccountNotFoundException(userId));

        BigDecimal balanceBefore = account.getBalance();
        account.apply(delta, Instant.now(clock));
        account = accountRepository.save(account);

        // POST-CONDITION: balance moved by exactly the delta
        BigDecimal expected = balanceBefore.add(delta.balance());
        if (account.getBalance().compareTo(expected) != 0) {
            throw new IllegalStateException(String.format(
                "BALANCE-DELTA VIOLATION: Account %s expected balance %s, actual %s",
                userId, expected, account.getBalance()));
        }
        log.debug("Delta applied - userId={}, delta={}, balance {} -> {}",
                userId, delta, balanceBefore, account.getBalance());
        return account;
    }

    /** Find an account without creating it. */
    @Transactional(readOnly = true)
    public Optional<TokenAccount> findByUserId(String userId) {
        return accountRepository.findByUserId(userId);
    }

    private TokenAccount provision(String userId) {
        try {
            return provisioner.create(userId);
        } catch (DataIntegrityViolationException e) {
            log.info("Concurrent account creation detected - userId={}, reading existing account", userId);
            return accountRepository.findByUserId(userId)
                    .orElseThrow(() -> new AccountNotFoundException(userId));
        }
    }

    private void validateUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User ID is required and must not be blank");
        }
    }
}
