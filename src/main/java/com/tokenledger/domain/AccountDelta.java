package com.tokenledger.domain;

import java.math.BigDecimal;

/**
 * Signed change to the numeric fields of a {@link TokenAccount}.
 *
 * <pre>
 * type     | balance | totalEarned | totalSpent | stakedAmount
 * ---------|---------|-------------|------------|-------------
 * EARN     |   +a    |     +a      |     0      |      0
 * SPEND    |   -a    |      0      |    +a      |      0
 * STAKE    |   -a    |      0      |    +a      |     +a
 * UNSTAKE  |   +a    |      0      |    -a      |     -a
 * </pre>
 *
 * Every row keeps {@code balance == totalEarned - totalSpent}.
 */
public record AccountDelta(
        BigDecimal balance,
        BigDecimal totalEarned,
        BigDecimal totalSpent,
        BigDecimal stakedAmount) {

    public AccountDelta {
        if (balance == null || totalEarned == null || totalSpent == null || stakedAmount == null) {
            throw new IllegalArgumentException("Delta components cannot be null");
        }
    }

    /**
     * Delta produced by accepting a transaction of the given type.
     *
     * @param amount positive amount
     */
    public static AccountDelta of(TransactionType type, BigDecimal amount) {
        if (type == null) {
            throw new IllegalArgumentException("Transaction type cannot be null");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Delta amount must be positive. Got: " + amount);
        }
        BigDecimal zero = BigDecimal.ZERO;
        return switch (type) {
            case EARN -> new AccountDelta(amount, amount, zero, zero);
            case SPEND -> new AccountDelta(amount.negate(), zero, amount, zero);
            case STAKE -> new AccountDelta(amount.negate(), zero, amount, amount);
            case UNSTAKE -> new AccountDelta(amount, zero, amount.negate(), amount.negate());
        };
    }
}
