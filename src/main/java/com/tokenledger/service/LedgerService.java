package com.tokenledger.service;

import com.tokenledger.config.LedgerPolicyProperties;
import com.tokenledger.domain.AccountDelta;
import com.tokenledger.domain.TokenAccount;
import com.tokenledger.domain.TokenTransaction;
import com.tokenledger.domain.TransactionType;
import com.tokenledger.exception.AccountNotFoundException;
import com.tokenledger.repository.TokenAccountRepository;
import com.tokenledger.repository.TokenTransactionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Append-only transaction ledger.
 *
 * Writes happen only through {@link #append}, inside the processor's unit of
 * work. Reads never create accounts.
 */
@Service
@Transactional(readOnly = true)
public class LedgerService {

    private static final Logger log = LoggerFactory.getLogger(LedgerService.class);

    // Newest first; equal timestamps in insertion order
    private static final Comparator<TokenTransaction> DISPLAY_ORDER =
            Comparator.comparing(TokenTransaction::getCreatedAt).reversed()
                    .thenComparing(TokenTransaction::getId);

    private final TokenTransactionRepository transactionRepository;
    private final TokenAccountRepository accountRepository;
    private final LedgerPolicyProperties policy;
    private final Clock clock;

    public LedgerService(TokenTransactionRepository transactionRepository,
                         TokenAccountRepository accountRepository,
                         LedgerPolicyProperties policy,
                         Clock clock) {
        this.transactionRepository = transactionRepository;
        this.accountRepository = accountRepository;
        this.policy = policy;
        this.clock = clock;
    }

    /**
     * Append one immutable entry stamped with the current clock time.
     *
     * The account must already reflect the entry's effect: its balance is
     * recorded as {@code balanceAfter}.
     *
     * @throws org.springframework.dao.DataIntegrityViolationException if the
     *         referenceId was already used for this account by a concurrent writer
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public TokenTransaction append(TokenAccount account,
                                   TransactionType type,
                                   BigDecimal amount,
                                   String source,
                                   String description,
                                   String referenceId) {
        TokenTransaction entry = new TokenTransaction(
                account, type, amount, source, description, referenceId, Instant.now(clock));
        entry = transactionRepository.saveAndFlush(entry);
        log.debug("Ledger entry appended - id={}, userId={}, type={}, amount={}, balanceAfter={}",
                entry.getId(), account.getUserId(), type, amount, entry.getBalanceAfter());
        return entry;
    }

    /**
     * The {@code limit} most recent entries for a user, newest first. Entries
     * with equal createdAt are shown in insertion order.
     *
     * @param limit 1..maxPageSize; larger values are capped
     * @return immutable list, empty for an unknown user
     * @throws IllegalArgumentException if limit &lt; 1
     */
    public List<TokenTransaction> recent(String userId, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Limit must be at least 1. Got: " + limit);
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User ID is required and must not be blank");
        }
        int pageSize = Math.min(limit, policy.maxPageSize());
        List<TokenTransaction> page = new ArrayList<>(transactionRepository
                .findByAccountUserIdOrderByCreatedAtDescIdDesc(userId, PageRequest.of(0, pageSize)));
        page.sort(DISPLAY_ORDER);
        return List.copyOf(page);
    }

    /**
     * Most recent entries using the configured default page size.
     */
    public List<TokenTransaction> recent(String userId) {
        return recent(userId, policy.defaultPageSize());
    }

    /**
     * Latest earn entry with the given source, if any.
     */
    public Optional<TokenTransaction> lastClaim(TokenAccount account, String source) {
        if (account.getId() == null) {
            return Optional.empty();
        }
        return transactionRepository.findFirstByAccountIdAndTypeAndSourceOrderByCreatedAtDescIdDesc(
                account.getId(), TransactionType.EARN, source);
    }

    /**
     * Entry previously written with this idempotency key for the user.
     */
    public Optional<TokenTransaction> findByReference(String userId, String referenceId) {
        if (referenceId == null || referenceId.isBlank()) {
            return Optional.empty();
        }
        return accountRepository.findByUserId(userId)
                .flatMap(account -> findByReference(account, referenceId));
    }

    /**
     * Idempotency lookup for an already loaded account.
     */
    public Optional<TokenTransaction> findByReference(TokenAccount account, String referenceId) {
        return transactionRepository.findByAccountIdAndReferenceId(account.getId(), referenceId);
    }

    /**
     * Replay the user's full ledger from the starting grant and compare with
     * the stored totals.
     *
     * @throws AccountNotFoundException if the user has no account
     */
    public ReconciliationReport reconcile(String userId) {
        TokenAccount account = accountRepository.findByUserId(userId)
                .orElseThrow(() -> new AccountNotFoundException(userId));

        List<TokenTransaction> history = transactionRepository.findByAccountIdOrderByIdAsc(account.getId());

        BigDecimal balance = account.getInitialGrant();
        BigDecimal earned = account.getInitialGrant();
        BigDecimal spent = BigDecimal.ZERO;
        BigDecimal staked = BigDecimal.ZERO;
        List<String> discrepancies = new ArrayList<>();

        for (TokenTransaction entry : history) {
            AccountDelta delta = AccountDelta.of(entry.getType(), entry.getAmount());
            balance = balance.add(delta.balance());
            earned = earned.add(delta.totalEarned());
            spent = spent.add(delta.totalSpent());
            staked = staked.add(delta.stakedAmount());
            if (balance.compareTo(entry.getBalanceAfter()) != 0) {
                discrepancies.add(String.format("entry %d: balanceAfter=%s, replayed=%s",
                        entry.getId(), entry.getBalanceAfter(), balance));
            }
        }

        ReconciliationReport.Totals stored = new ReconciliationReport.Totals(
                account.getBalance(), account.getTotalEarned(), account.getTotalSpent(), account.getStakedAmount());
        ReconciliationReport.Totals replayed = new ReconciliationReport.Totals(balance, earned, spent, staked);

        compare("balance", stored.balance(), replayed.balance(), discrepancies);
        compare("totalEarned", stored.totalEarned(), replayed.totalEarned(), discrepancies);
        compare("totalSpent", stored.totalSpent(), replayed.totalSpent(), discrepancies);
        compare("stakedAmount", stored.stakedAmount(), replayed.stakedAmount(), discrepancies);

        if (discrepancies.isEmpty()) {
            log.info("Reconciliation OK - userId={}, entries={}", userId, history.size());
        } else {
            log.warn("Reconciliation drift - userId={}, entries={}, discrepancies={}",
                    userId, history.size(), discrepancies);
        }
        return new ReconciliationReport(userId, history.size(), stored, replayed, discrepancies);
    }

    private static void compare(String field, BigDecimal stored, BigDecimal replayed, List<String> out) {
        if (stored.compareTo(replayed) != 0) {
            out.add(String.format("%s: stored=%s, replayed=%s", field, stored, replayed));
        }
    }
}
