package com.tokenledger.service;

/**
 * Typed reasons for refusing a proposed transaction.
 *
 * Codes and messages are stable: clients map them to user-facing text.
 */
public enum RejectionReason {
    INVALID_AMOUNT("Amount must be a positive number with at most 4 decimal places"),
    INSUFFICIENT_BALANCE("Insufficient balance"),
    BELOW_MINIMUM_STAKE("Stake amount is below the minimum stake"),
    EXCEEDS_STAKED_AMOUNT("Unstake amount exceeds the currently staked amount"),
    ALREADY_CLAIMED_TODAY("Daily reward has already been claimed in the current reward window");

    private final String defaultMessage;

    RejectionReason(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String code() {
        return name();
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
