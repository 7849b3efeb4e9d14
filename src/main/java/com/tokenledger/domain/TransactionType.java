package com.tokenledger.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of ledger transaction types.
 *
 * The wire form is the lowercase name ("earn", "spend", "stake", "unstake").
 * Any other value is rejected at the boundary by {@link #fromValue(String)}.
 */
public enum TransactionType {
    EARN,      // Credit: rewards, referrals, starting bonuses
    SPEND,     // Debit: purchases, fee discounts, subscriptions
    STAKE,     // Lock: moves tokens out of the spendable balance into the staked counter
    UNSTAKE;   // Unlock: returns previously staked tokens to the spendable balance

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse the wire form of a transaction type.
     *
     * @throws IllegalArgumentException for null, blank or unknown values
     */
    @JsonCreator
    public static TransactionType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Transaction type is required");
        }
        for (TransactionType type : values()) {
            if (type.value().equalsIgnoreCase(value.strip())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported transaction type: " + value);
    }

    /** True for types that draw on the spendable balance. */
    public boolean debitsBalance() {
        return this == SPEND || this == STAKE;
    }
}
