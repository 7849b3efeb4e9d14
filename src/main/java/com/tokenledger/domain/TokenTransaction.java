package com.tokenledger.domain;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * One accepted, immutable token movement.
 *
 * LEDGER RULES:
 * 1. Entries are IMMUTABLE - all columns are updatable = false, no setters
 * 2. Entries are APPEND-ONLY - never deleted
 * 3. amount is always positive; the direction comes from {@link TransactionType}
 * 4. id is assigned by the database in insertion order and breaks createdAt ties
 *
 * referenceId is an optional client idempotency key, unique per account.
 */
@Entity
@Table(
    name = "token_transactions",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_token_tx_account_reference", columnNames = {"account_id", "reference_id"})
    },
    indexes = {
        @Index(name = "idx_token_tx_account_created", columnList = "account_id,created_at"),
        @Index(name = "idx_token_tx_account_source", columnList = "account_id,source")
    }
)
public class TokenTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "account_id", nullable = false, updatable = false)
    private TokenAccount account;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private TransactionType type;

    @Column(nullable = false, precision = 19, scale = 4, updatable = false)
    private BigDecimal amount;

    /**
     * Machine-readable label of the causing activity (daily_reward, staking, referral, ...).
     */
    @Column(nullable = false, length = 64, updatable = false)
    private String source;

    @Column(length = 500, updatable = false)
    private String description;

    @Column(name = "reference_id", length = 255, updatable = false)
    private String referenceId;

    /**
     * Account balance right after this entry was applied.
     */
    @Column(name = "balance_after", nullable = false, precision = 19, scale = 4, updatable = false)
    private BigDecimal balanceAfter;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * JPA requires a no-arg constructor.
     */
    protected TokenTransaction() {
    }

    /**
     * Create a ledger entry for an already-applied account change.
     *
     * createdAt is truncated to microseconds so the stored value and the
     * in-memory value compare equal on every supported database.
     */
    public TokenTransaction(TokenAccount account,
                            TransactionType type,
                            BigDecimal amount,
                            String source,
                            String description,
                            String referenceId,
                            Instant createdAt) {
        if (account == null) {
            throw new IllegalArgumentException("Account cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("Transaction type cannot be null");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("Source cannot be null or blank");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("Creation time cannot be null");
        }
        this.account = account;
        this.type = type;
        this.amount = amount;
        this.source = source;
        this.description = description;
        this.referenceId = (referenceId == null || referenceId.isBlank()) ? null : referenceId;
        this.balanceAfter = account.getBalance();
        this.createdAt = createdAt.truncatedTo(ChronoUnit.MICROS);
    }

    // Getters only - no setters (immutability)

    public Long getId() {
        return id;
    }

    public TokenAccount getAccount() {
        return account;
    }

    public TransactionType getType() {
        return type;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public String getSource() {
        return source;
    }

    public String getDescription() {
        return description;
    }

    public String getReferenceId() {
        return referenceId;
    }

    public BigDecimal getBalanceAfter() {
        return balanceAfter;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TokenTransaction that = (TokenTransaction) o;
        return id != null && Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }

    @Override
    public String toString() {
        return "TokenTransaction{" +
                "id=" + id +
                ", userId=" + (account != null ? account.getUserId() : null) +
                ", type=" + type +
                ", amount=" + amount +
                ", source='" + source + '\'' +
                ", referenceId='" + referenceId + '\'' +
                ", createdAt=" + createdAt +
                '}';
    }
}
