package com.tokenledger.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.math.BigDecimal;
import java.time.ZoneId;

/**
 * Ledger policy knobs, bound from {@code tokenledger.policy.*}.
 */
@ConfigurationProperties("tokenledger.policy")
public record LedgerPolicyProperties(
        @DefaultValue("1000") BigDecimal startingGrant,      // credited on lazy account creation
        @DefaultValue("100")  BigDecimal minimumStake,
        @DefaultValue("100")  BigDecimal dailyRewardAmount,
        @DefaultValue("UTC")  ZoneId     rewardZone,         // calendar day boundary for daily rewards
        @DefaultValue("20")   int        defaultPageSize,
        @DefaultValue("100")  int        maxPageSize
) {

    public LedgerPolicyProperties {
        if (startingGrant == null || startingGrant.signum() < 0) {
            throw new IllegalArgumentException("tokenledger.policy.starting-grant must be >= 0");
        }
        if (minimumStake == null || minimumStake.signum() <= 0) {
            throw new IllegalArgumentException("tokenledger.policy.minimum-stake must be > 0");
        }
        if (dailyRewardAmount == null || dailyRewardAmount.signum() <= 0) {
            throw new IllegalArgumentException("tokenledger.policy.daily-reward-amount must be > 0");
        }
        if (defaultPageSize < 1 || maxPageSize < defaultPageSize) {
            throw new IllegalArgumentException(
                "tokenledger.policy page sizes must satisfy 1 <= default-page-size <= max-page-size");
        }
    }

    /** Defaults used when nothing is configured. */
    public static LedgerPolicyProperties defaults() {
        return new LedgerPolicyProperties(
                new BigDecimal("1000"), new BigDecimal("100"), new BigDecimal("100"),
                ZoneId.of("UTC"), 20, 100);
    }
}
