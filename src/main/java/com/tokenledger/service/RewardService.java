package com.tokenledger.service;

import com.tokenledger.config.LedgerPolicyProperties;
import com.tokenledger.domain.TransactionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named reward and staking operations on top of {@link TransactionProcessor}.
 *
 * Each method is a single {@code propose} call with a fixed type, source and
 * description; all rules live in the processor.
 */
@Service
public class RewardService {

    private static final Logger log = LoggerFactory.getLogger(RewardService.class);

    private final TransactionProcessor processor;
    private final LedgerPolicyProperties policy;

    public RewardService(TransactionProcessor processor, LedgerPolicyProperties policy) {
        this.processor = processor;
        this.policy = policy;
    }

    /**
     * Credit the daily login reward; at most once per reward window.
     */
    public TransactionOutcome claimDailyReward(String userId) {
        log.debug("Daily reward claim - userId={}", userId);
        return processor.propose(userId, TransactionType.EARN, policy.dailyRewardAmount(),
                TransactionSources.DAILY_REWARD, "Daily login reward");
    }

    public TransactionOutcome stake(String userId, BigDecimal amount) {
        return processor.propose(userId, TransactionType.STAKE, amount,
                TransactionSources.STAKING, "Staked " + format(amount) + " VDO tokens");
    }

    public TransactionOutcome unstake(String userId, BigDecimal amount) {
        return processor.propose(userId, TransactionType.UNSTAKE, amount,
                TransactionSources.STAKING, "Unstaked " + format(amount) + " VDO tokens");
    }

    /**
     * Credit a catalogued earning activity.
     *
     * @param amount      amount to credit; the activity's default when null
     * @param referenceId optional event id; redelivery of the same id is a no-op
     */
    public TransactionOutcome grantReward(String userId,
                                          EarningActivity activity,
                                          BigDecimal amount,
                                          String referenceId) {
        if (activity == null) {
            throw new IllegalArgumentException("Earning activity is required");
        }
        BigDecimal credited = amount != null ? amount : activity.defaultAmount();
        log.debug("Reward grant - userId={}, activity={}, amount={}, referenceId={}",
                userId, activity, credited, referenceId);
        return processor.propose(userId, TransactionType.EARN, credited,
                activity.source(), activity.description(), referenceId);
    }

    /**
     * Source label → default amount for every earning activity, daily reward first.
     */
    public Map<String, BigDecimal> earningCatalog() {
        Map<String, BigDecimal> catalog = new LinkedHashMap<>();
        catalog.put(TransactionSources.DAILY_REWARD, policy.dailyRewardAmount());
        for (EarningActivity activity : EarningActivity.values()) {
            catalog.put(activity.source(), activity.defaultAmount());
        }
        return Collections.unmodifiableMap(catalog);
    }

    private static String format(BigDecimal amount) {
        return amount == null ? "null" : amount.stripTrailingZeros().toPlainString();
    }
}
