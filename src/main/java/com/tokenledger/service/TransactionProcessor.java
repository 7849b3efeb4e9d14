package com.tokenledger.service;

import com.tokenledger.config.LedgerPolicyProperties;
import com.tokenledger.domain.AccountDelta;
import com.tokenledger.domain.TokenAccount;
import com.tokenledger.domain.TokenTransaction;
import com.tokenledger.domain.TransactionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Decides whether a proposed token movement is accepted.
 *
 * CRITICAL: every accepted proposal MUST:
 * 1. Validate the amount before touching storage
 * 2. Make sure the account exists BEFORE the unit of work opens
 *    (creation runs in its own transaction; holding one pooled connection
 *    while waiting for a second one starves the pool under load)
 * 3. Lock the account row (PESSIMISTIC_WRITE) before any balance check
 * 4. Apply the account delta and append the ledger entry in ONE transaction
 * 5. Leave the account consistent (balance == totalEarned - totalSpent)
 *
 * Rejections are returned as {@link TransactionOutcome} values and change nothing.
 */
@Service
public class TransactionProcessor {

    private static final Logger log = LoggerFactory.getLogger(TransactionProcessor.class);

    static final int MAX_SCALE = 4;
    // precision 19, scale 4 columns
    static final int MAX_INTEGER_DIGITS = 15;
    static final int MAX_DESCRIPTION_LENGTH = 500;
    static final int MAX_REFERENCE_LENGTH = 255;

    private final AccountService accountService;
    private final LedgerService ledgerService;
    private final LedgerPolicyProperties policy;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;

    public TransactionProcessor(AccountService accountService,
                                LedgerService ledgerService,
                                LedgerPolicyProperties policy,
                                Clock clock,
                                TransactionTemplate transactionTemplate) {
        this.accountService = accountService;
        this.ledgerService = ledgerService;
        this.policy = policy;
        this.clock = clock;
        this.transactionTemplate = transactionTemplate;
    }

    /**
     * Propose a transaction without an idempotency key.
     *
     * @see #propose(String, TransactionType, BigDecimal, String, String, String)
     */
    public TransactionOutcome propose(String userId,
                                      TransactionType type,
                                      BigDecimal amount,
                                      String source,
                                      String description) {
        return propose(userId, type, amount, source, description, null);
    }

    /**
     * Propose a transaction.
     *
     * Checks, first failure wins:
     * 1. INVALID_AMOUNT - amount null, not positive, or more than 4 decimals (no storage access)
     * 2. (replay) - referenceId already recorded for this account: stored entry returned, no effect
     * 3. INSUFFICIENT_BALANCE - spend/stake above the spendable balance
     * 4. BELOW_MINIMUM_STAKE - stake below the configured minimum
     * 5. EXCEEDS_STAKED_AMOUNT - unstake above the currently staked amount
     * 6. ALREADY_CLAIMED_TODAY - second daily_reward earn in one reward window
     *
     * @param userId      account owner; the account is created on first use
     * @param type        transaction type
     * @param amount      positive amount, at most 4 decimal places
     * @param source      non-blank label, at most 64 characters
     * @param description optional note
     * @param referenceId optional idempotency key, unique per account
     * @return accepted (or replayed) outcome with the account and entry, or a rejection
     * @throws IllegalArgumentException if userId, type or source is missing or malformed
     * @throws IllegalStateException if an accounting invariant would be violated
     */
    public TransactionOutcome propose(String userId,
                                      TransactionType type,
                                      BigDecimal amount,
                                      String source,
                                      String description,
                                      String referenceId) {
        validateRequest(userId, type, source, description, referenceId);

        log.debug("Proposal received - userId={}, type={}, amount={}, source={}, referenceId={}",
                userId, type, amount, source, referenceId);

        if (!isValidAmount(amount)) {
            log.info("Proposal rejected - userId={}, type={}, reason={}, amount={}",
                    userId, type, RejectionReason.INVALID_AMOUNT, amount);
            return TransactionOutcome.rejected(RejectionReason.INVALID_AMOUNT);
        }

        // Lazy creation commits on its own, outside the unit of work below
        accountService.getAccount(userId);

        return transactionTemplate.execute(status ->
                decide(userId, type, amount, source, description, referenceId));
    }

    private TransactionOutcome decide(String userId,
                                      TransactionType type,
                                      BigDecimal amount,
                                      String source,
                                      String description,
                                      String referenceId) {
        // Serializes all proposals for this user until commit
        TokenAccount account = accountService.lockAccount(userId);

        if (referenceId != null && !referenceId.isBlank()) {
            Optional<TokenTransaction> existing = ledgerService.findByReference(account, referenceId);
            if (existing.isPresent()) {
                log.info("Proposal replayed - userId={}, referenceId={}, transactionId={}",
                        userId, referenceId, existing.get().getId());
                return TransactionOutcome.replayed(account, existing.get());
            }
        }

        Optional<TransactionOutcome> rejection = checkPolicy(account, type, amount, source);
        if (rejection.isPresent()) {
            log.info("Proposal rejected - userId={}, type={}, amount={}, reason={}",
                    userId, type, amount, rejection.get().getRejection());
            return rejection.get();
        }

        BigDecimal balanceBefore = account.getBalance();
        AccountDelta delta = AccountDelta.of(type, amount);

        TokenAccount updated = accountService.apply(userId, delta);
        TokenTransaction entry = ledgerService.append(updated, type, amount, source, description, referenceId);

        // POST-CONDITION: the entry records the balance the account ended with
        if (entry.getBalanceAfter().compareTo(updated.getBalance()) != 0) {
            throw new IllegalStateException(String.format(
                "LEDGER-BALANCE VIOLATION: Entry %s balanceAfter=%s but account balance=%s",
                entry.getId(), entry.getBalanceAfter(), updated.getBalance()));
        }

        log.info("Proposal accepted - userId={}, type={}, amount={}, source={}, balance {} -> {}, transactionId={}",
                userId, type, amount, source, balanceBefore, updated.getBalance(), entry.getId());
        return TransactionOutcome.accepted(updated, entry);
    }

    private Optional<TransactionOutcome> checkPolicy(TokenAccount account,
                                                     TransactionType type,
                                                     BigDecimal amount,
                                                     String source) {
        if (type.debitsBalance() && !account.hasSufficientBalance(amount)) {
            return Optional.of(TransactionOutcome.rejected(RejectionReason.INSUFFICIENT_BALANCE,
                    String.format("Insufficient balance: available %s, requested %s",
                            account.getBalance().stripTrailingZeros().toPlainString(),
                            amount.stripTrailingZeros().toPlainString())));
        }
        if (type == TransactionType.STAKE && amount.compareTo(policy.minimumStake()) < 0) {
            return Optional.of(TransactionOutcome.rejected(RejectionReason.BELOW_MINIMUM_STAKE,
                    "Minimum stake is " + policy.minimumStake().stripTrailingZeros().toPlainString()));
        }
        if (type == TransactionType.UNSTAKE && !account.hasStaked(amount)) {
            return Optional.of(TransactionOutcome.rejected(RejectionReason.EXCEEDS_STAKED_AMOUNT,
                    String.format("Cannot unstake %s: only %s staked",
                            amount.stripTrailingZeros().toPlainString(),
                            account.getStakedAmount().stripTrailingZeros().toPlainString())));
        }
        if (type == TransactionType.EARN
                && TransactionSources.DAILY_REWARD.equals(source)
                && claimedInCurrentWindow(account)) {
            return Optional.of(TransactionOutcome.rejected(RejectionReason.ALREADY_CLAIMED_TODAY));
        }
        return Optional.empty();
    }

    private boolean claimedInCurrentWindow(TokenAccount account) {
        LocalDate today = LocalDate.now(clock.withZone(policy.rewardZone()));
        return ledgerService.lastClaim(account, TransactionSources.DAILY_REWARD)
                .map(last -> last.getCreatedAt().atZone(policy.rewardZone()).toLocalDate().equals(today))
                .orElse(false);
    }

    static boolean isValidAmount(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            return false;
        }
        BigDecimal normalized = amount.stripTrailingZeros();
        if (normalized.scale() > MAX_SCALE) {
            return false;
        }
        return normalized.precision() - normalized.scale() <= MAX_INTEGER_DIGITS;
    }

    private void validateRequest(String userId,
                                 TransactionType type,
                                 String source,
                                 String description,
                                 String referenceId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User ID is required and must not be blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("Transaction type is required");
        }
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("Source is required and must not be blank");
        }
        if (source.length() > TransactionSources.MAX_LENGTH) {
            throw new IllegalArgumentException(
                "Source must be at most " + TransactionSources.MAX_LENGTH + " characters");
        }
        if (description != null && description.length() > MAX_DESCRIPTION_LENGTH) {
            throw new IllegalArgumentException(
                "Description must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        if (referenceId != null && referenceId.length() > MAX_REFERENCE_LENGTH) {
            throw new IllegalArgumentException(
                "Reference ID must be at most " + MAX_REFERENCE_LENGTH + " characters");
        }
    }
}
