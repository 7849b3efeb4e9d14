package com.tokenledger.service;

import com.tokenledger.domain.TokenAccount;
import com.tokenledger.domain.TokenTransaction;

import java.util.Objects;

/**
 * Result of {@link TransactionProcessor#propose}: either an accepted change
 * (account snapshot + ledger entry) or a typed rejection with no effect.
 */
public final class TransactionOutcome {

    private final TokenAccount account;
    private final TokenTransaction transaction;
    private final RejectionReason rejection;
    private final String message;
    private final boolean replayed;

    private TransactionOutcome(TokenAccount account,
                               TokenTransaction transaction,
                               RejectionReason rejection,
                               String message,
                               boolean replayed) {
        this.account = account;
        this.transaction = transaction;
        this.rejection = rejection;
        this.message = message;
        this.replayed = replayed;
    }

    public static TransactionOutcome accepted(TokenAccount account, TokenTransaction transaction) {
        return new TransactionOutcome(
                Objects.requireNonNull(account), Objects.requireNonNull(transaction), null, null, false);
    }

    /**
     * A repeated referenceId: the stored entry is returned and nothing new is applied.
     */
    public static TransactionOutcome replayed(TokenAccount account, TokenTransaction transaction) {
        return new TransactionOutcome(
                Objects.requireNonNull(account), Objects.requireNonNull(transaction), null, null, true);
    }

    public static TransactionOutcome rejected(RejectionReason reason, String message) {
        Objects.requireNonNull(reason);
        return new TransactionOutcome(
                null, null, reason, message != null ? message : reason.defaultMessage(), false);
    }

    public static TransactionOutcome rejected(RejectionReason reason) {
        return rejected(reason, null);
    }

    public boolean isAccepted() {
        return rejection == null;
    }

    public boolean isRejected() {
        return rejection != null;
    }

    public boolean isReplayed() {
        return replayed;
    }

    /** Account after the change; null when rejected. */
    public TokenAccount getAccount() {
        return account;
    }

    /** Ledger entry written (or replayed); null when rejected. */
    public TokenTransaction getTransaction() {
        return transaction;
    }

    /** Rejection reason; null when accepted. */
    public RejectionReason getRejection() {
        return rejection;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return isAccepted()
                ? "TransactionOutcome{accepted" + (replayed ? ", replayed" : "") + ", transaction=" + transaction + '}'
                : "TransactionOutcome{rejected=" + rejection + ", message='" + message + "'}";
    }
}
