package com.tokenledger.service;

import com.tokenledger.config.LedgerPolicyProperties;
import com.tokenledger.domain.TokenAccount;
import com.tokenledger.repository.TokenAccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Inserts new accounts in their own transaction.
 *
 * A concurrent creator for the same user makes the insert fail with a
 * DataIntegrityViolationException (unique user_id). Running in REQUIRES_NEW
 * keeps that failure from poisoning the caller's transaction, so the caller
 * can simply re-read the winner's row.
 */
@Component
public class AccountProvisioner {

    private static final Logger log = LoggerFactory.getLogger(AccountProvisioner.class);

    private final TokenAccountRepository accountRepository;
    private final LedgerPolicyProperties policy;
    private final Clock clock;

    public AccountProvisioner(TokenAccountRepository accountRepository,
                              LedgerPolicyProperties policy,
                              Clock clock) {
        this.accountRepository = accountRepository;
        this.policy = policy;
        this.clock = clock;
    }

    /**
     * Create the account with the starting grant.
     *
     * @throws org.springframework.dao.DataIntegrityViolationException if another
     *         transaction created the same user's account first
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public TokenAccount create(String userId) {
        TokenAccount account = new TokenAccount(userId, policy.startingGrant(), Instant.now(clock));
        account = accountRepository.saveAndFlush(account);
        log.info("Account opened - userId={}, accountId={}, startingGrant={}",
                userId, account.getId(), account.getInitialGrant());
        return account;
    }
}
