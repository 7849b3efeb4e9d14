package com.tokenledger.repository;

import com.tokenledger.domain.TokenTransaction;
import com.tokenledger.domain.TransactionType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for the append-only token ledger.
 *
 * Only inserts and reads are used; entries are never updated or deleted.
 *
 * Ordering conventions:
 * - Page selection: createdAt DESC, id DESC (the newest entries of a tie group
 *   make the cut); LedgerService reorders ties to insertion order for display
 * - Replay: id ASC (exact insertion order)
 */
@Repository
public interface TokenTransactionRepository extends JpaRepository<TokenTransaction, Long> {

    /**
     * Most recent entries for a user, newest first.
     * The page size comes from the Pageable (first page only is ever requested).
     */
    List<TokenTransaction> findByAccountUserIdOrderByCreatedAtDescIdDesc(String userId, Pageable pageable);

    /**
     * Full history for replay and reconciliation, oldest first.
     */
    List<TokenTransaction> findByAccountIdOrderByIdAsc(Long accountId);

    /**
     * Latest entry of a given type and source, used for once-per-window rewards.
     */
    Optional<TokenTransaction> findFirstByAccountIdAndTypeAndSourceOrderByCreatedAtDescIdDesc(
            Long accountId, TransactionType type, String source);

    /**
     * Idempotency lookup. referenceId is unique per account.
     */
    Optional<TokenTransaction> findByAccountIdAndReferenceId(Long accountId, String referenceId);
}
