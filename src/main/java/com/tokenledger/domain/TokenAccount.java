package com.tokenledger.domain;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Per-user token account: spendable balance plus lifetime aggregates.
 *
 * Critical accounting rules:
 * - balance == totalEarned - totalSpent (a stake is booked as a spend into stakedAmount)
 * - balance, totalEarned, totalSpent and stakedAmount are never negative
 * - stakedAmount never exceeds totalSpent
 * - Numeric fields have NO public setters; they change only through {@link #apply(AccountDelta, Instant)}
 *
 * Design decisions:
 * - userId is an opaque identifier and unique (one account per user, enforced by the database)
 * - initialGrant is stored so the ledger can be replayed without guessing the starting bonus
 * - Precision: 19 digits, 4 decimal places, same as ledger amounts
 * - Optimistic locking via @Version on top of the pessimistic row lock used by writers
 */
@Entity
@Table(
    name = "token_accounts",
    indexes = {
        @Index(name = "idx_token_accounts_user_id", columnList = "user_id", unique = true)
    }
)
public class TokenAccount {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, unique = true, length = 128, updatable = false)
    private String userId;

    /**
     * Tokens currently available to spend or stake.
     */
    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal balance;

    @Column(name = "total_earned", nullable = false, precision = 19, scale = 4)
    private BigDecimal totalEarned;

    @Column(name = "total_spent", nullable = false, precision = 19, scale = 4)
    private BigDecimal totalSpent;

    /**
     * Tokens locked by stakes that have not been released yet.
     */
    @Column(name = "staked_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal stakedAmount;

    @Column(name = "initial_grant", nullable = false, precision = 19, scale = 4, updatable = false)
    private BigDecimal initialGrant;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    /**
     * JPA requires a no-arg constructor.
     */
    protected TokenAccount() {
    }

    /**
     * Open an account with its starting grant.
     *
     * The grant counts as earned: balance = totalEarned = initialGrant.
     *
     * @param userId opaque user identifier (not blank)
     * @param initialGrant starting balance, zero or positive
     * @param createdAt creation time
     */
    public TokenAccount(String userId, BigDecimal initialGrant, Instant createdAt) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User ID cannot be null or blank");
        }
        if (initialGrant == null || initialGrant.signum() < 0) {
            throw new IllegalArgumentException("Initial grant cannot be null or negative");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("Creation time cannot be null");
        }
        this.userId = userId;
        this.initialGrant = initialGrant;
        this.balance = initialGrant;
        this.totalEarned = initialGrant;
        this.totalSpent = BigDecimal.ZERO;
        this.stakedAmount = BigDecimal.ZERO;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    // Getters
    public Long getId() {
        return id;
    }

    public String getUserId() {
        return userId;
    }

    public BigDecimal getBalance() {
        return balance;
    }

    public BigDecimal getTotalEarned() {
        return totalEarned;
    }

    public BigDecimal getTotalSpent() {
        return totalSpent;
    }

    public BigDecimal getStakedAmount() {
        return stakedAmount;
    }

    public BigDecimal getInitialGrant() {
        return initialGrant;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Long getVersion() {
        return version;
    }

    // Business methods

    /**
     * Apply a delta to all numeric fields at once.
     *
     * The new values are computed and checked before anything is assigned,
     * so a rejected delta leaves the account untouched.
     *
     * @throws IllegalStateException if the result would break an accounting invariant
     */
    public void apply(AccountDelta delta, Instant at) {
        if (delta == null) {
            throw new IllegalArgumentException("Delta cannot be null");
        }
        BigDecimal newBalance = balance.add(delta.balance());
        BigDecimal newEarned = totalEarned.add(delta.totalEarned());
        BigDecimal newSpent = totalSpent.add(delta.totalSpent());
        BigDecimal newStaked = stakedAmount.add(delta.stakedAmount());

        if (newBalance.signum() < 0) {
            throw new IllegalStateException(String.format(
                "NEGATIVE-BALANCE VIOLATION: Account %s balance would become %s", userId, newBalance));
        }
        if (delta.totalEarned().signum() < 0) {
            throw new IllegalStateException(String.format(
                "EARNED-MONOTONIC VIOLATION: Account %s totalEarned cannot decrease (delta %s)",
                userId, delta.totalEarned()));
        }
        if (delta.totalSpent().signum() < 0
                && delta.totalSpent().compareTo(delta.stakedAmount()) != 0) {
            throw new IllegalStateException(String.format(
                "SPENT-MONOTONIC VIOLATION: Account %s totalSpent may only decrease by releasing a stake",
                userId));
        }
        if (newSpent.signum() < 0 || newStaked.signum() < 0) {
            throw new IllegalStateException(String.format(
                "NEGATIVE-TOTAL VIOLATION: Account %s totalSpent=%s stakedAmount=%s",
                userId, newSpent, newStaked));
        }

        this.balance = newBalance;
        this.totalEarned = newEarned;
        this.totalSpent = newSpent;
        this.stakedAmount = newStaked;
        this.updatedAt = at != null ? at : this.updatedAt;
        verifyInvariants();
    }

    /**
     * Check if the spendable balance covers the amount.
     */
    public boolean hasSufficientBalance(BigDecimal amount) {
        return balance.compareTo(amount) >= 0;
    }

    /**
     * Check if at least {@code amount} tokens are currently staked.
     */
    public boolean hasStaked(BigDecimal amount) {
        return stakedAmount.compareTo(amount) >= 0;
    }

    /**
     * Verify the accounting identities between the four numeric fields.
     *
     * @throws IllegalStateException on the first violated identity
     */
    public void verifyInvariants() {
        BigDecimal expectedBalance = totalEarned.subtract(totalSpent);
        if (balance.compareTo(expectedBalance) != 0) {
            throw new IllegalStateException(String.format(
                "BALANCE-IDENTITY VIOLATION: Account %s balance=%s but totalEarned-totalSpent=%s",
                userId, balance, expectedBalance));
        }
        if (balance.signum() < 0) {
            throw new IllegalStateException(String.format(
                "NEGATIVE-BALANCE VIOLATION: Account %s balance=%s", userId, balance));
        }
        if (totalEarned.signum() < 0 || totalSpent.signum() < 0 || stakedAmount.signum() < 0) {
            throw new IllegalStateException(String.format(
                "NEGATIVE-TOTAL VIOLATION: Account %s earned=%s spent=%s staked=%s",
                userId, totalEarned, totalSpent, stakedAmount));
        }
        if (stakedAmount.compareTo(totalSpent) > 0) {
            throw new IllegalStateException(String.format(
                "STAKE-BOUND VIOLATION: Account %s stakedAmount=%s exceeds totalSpent=%s",
                userId, stakedAmount, totalSpent));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TokenAccount that = (TokenAccount) o;
        return Objects.equals(userId, that.userId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId);
    }

    @Override
    public String toString() {
        return "TokenAccount{" +
                "id=" + id +
                ", userId='" + userId + '\'' +
                ", balance=" + balance +
                ", totalEarned=" + totalEarned +
                ", totalSpent=" + totalSpent +
                ", stakedAmount=" + stakedAmount +
                ", version=" + version +
                '}';
    }
}
