package com.tokenledger.service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Stored account totals compared with the totals recomputed by replaying
 * the ledger from the starting grant.
 *
 * @param userId       account owner
 * @param entryCount   number of ledger entries replayed
 * @param stored       totals as persisted on the account
 * @param replayed     totals recomputed from the ledger
 * @param discrepancies one line per field that differs; empty when consistent
 */
public record ReconciliationReport(
        String userId,
        long entryCount,
        Totals stored,
        Totals replayed,
        List<String> discrepancies) {

    public ReconciliationReport {
        discrepancies = List.copyOf(discrepancies);
    }

    public boolean isConsistent() {
        return discrepancies.isEmpty();
    }

    /**
     * The four numeric account fields.
     */
    public record Totals(
            BigDecimal balance,
            BigDecimal totalEarned,
            BigDecimal totalSpent,
            BigDecimal stakedAmount) {
    }
}
