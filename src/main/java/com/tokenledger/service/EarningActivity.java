package com.tokenledger.service;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Catalogued ways to earn tokens, with the amount credited when the caller
 * does not name one.
 */
public enum EarningActivity {
    REFERRAL(TransactionSources.REFERRAL, "500", "Referral reward"),
    CONTENT_COMPLETION(TransactionSources.CONTENT_COMPLETION, "25", "Learning content completed"),
    LENDING(TransactionSources.LENDING, "50", "Platform fee reward for lending"),
    LOAN_REPAYMENT(TransactionSources.LOAN_REPAYMENT, "100", "On-time loan repayment reward");

    private final String source;
    private final BigDecimal defaultAmount;
    private final String description;

    EarningActivity(String source, String defaultAmount, String description) {
        this.source = source;
        this.defaultAmount = new BigDecimal(defaultAmount);
        this.description = description;
    }

    public String source() {
        return source;
    }

    public BigDecimal defaultAmount() {
        return defaultAmount;
    }

    public String description() {
        return description;
    }

    /**
     * Resolve an activity from its source label ("referral", "content_completion", ...).
     * Hyphens are accepted in place of underscores.
     *
     * @throws IllegalArgumentException for unknown labels
     */
    public static EarningActivity fromSource(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Earning activity is required");
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT).replace('-', '_');
        for (EarningActivity activity : values()) {
            if (activity.source.equals(normalized)) {
                return activity;
            }
        }
        throw new IllegalArgumentException("Unknown earning activity: " + value);
    }
}
