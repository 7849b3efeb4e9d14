package com.tokenledger.service;

/**
 * Source labels written by the built-in reward and staking operations.
 * Callers of {@code propose} may use any other non-blank label.
 */
public final class TransactionSources {

    public static final String DAILY_REWARD = "daily_reward";
    public static final String STAKING = "staking";
    public static final String REFERRAL = "referral";
    public static final String CONTENT_COMPLETION = "content_completion";
    public static final String LENDING = "lending";
    public static final String LOAN_REPAYMENT = "loan_repayment";

    public static final int MAX_LENGTH = 64;

    private TransactionSources() {
    }
}
