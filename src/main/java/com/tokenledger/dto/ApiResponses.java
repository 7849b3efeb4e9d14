package com.tokenledger.dto;

import com.tokenledger.domain.TokenAccount;
import com.tokenledger.domain.TokenTransaction;
import com.tokenledger.service.ReconciliationReport;
import com.tokenledger.service.TransactionOutcome;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Response DTOs for API endpoints.
 */
public class ApiResponses {

    /**
     * Account balance and aggregates.
     */
    public static class AccountResponse {
        private String userId;
        private BigDecimal balance;
        private BigDecimal totalEarned;
        private BigDecimal totalSpent;
        private BigDecimal stakedAmount;
        private Instant createdAt;
        private Instant updatedAt;

        public AccountResponse(TokenAccount account) {
            this.userId = account.getUserId();
            this.balance = account.getBalance();
            this.totalEarned = account.getTotalEarned();
            this.totalSpent = account.getTotalSpent();
            this.stakedAmount = account.getStakedAmount();
            this.createdAt = account.getCreatedAt();
            this.updatedAt = account.getUpdatedAt();
        }

        // Getters
        public String getUserId() { return userId; }
        public BigDecimal getBalance() { return balance; }
        public BigDecimal getTotalEarned() { return totalEarned; }
        public BigDecimal getTotalSpent() { return totalSpent; }
        public BigDecimal getStakedAmount() { return stakedAmount; }
        public Instant getCreatedAt() { return createdAt; }
        public Instant getUpdatedAt() { return updatedAt; }
    }

    /**
     * Ledger entry.
     */
    public static class TransactionResponse {
        private Long transactionId;
        private String type;
        private BigDecimal amount;
        private String source;
        private String description;
        private String referenceId;
        private BigDecimal balanceAfter;
        private Instant createdAt;

        public TransactionResponse(TokenTransaction entry) {
            this.transactionId = entry.getId();
            this.type = entry.getType().value();
            this.amount = entry.getAmount();
            this.source = entry.getSource();
            this.description = entry.getDescription();
            this.referenceId = entry.getReferenceId();
            this.balanceAfter = entry.getBalanceAfter();
            this.createdAt = entry.getCreatedAt();
        }

        // Getters
        public Long getTransactionId() { return transactionId; }
        public String getType() { return type; }
        public BigDecimal getAmount() { return amount; }
        public String getSource() { return source; }
        public String getDescription() { return description; }
        public String getReferenceId() { return referenceId; }
        public BigDecimal getBalanceAfter() { return balanceAfter; }
        public Instant getCreatedAt() { return createdAt; }
    }

    /**
     * Accepted proposal: the account after the change and the entry written.
     * {@code replayed} is true when an earlier entry with the same referenceId was returned.
     */
    public static class TransactionResultResponse {
        private AccountResponse account;
        private TransactionResponse transaction;
        private boolean replayed;

        public TransactionResultResponse(TransactionOutcome outcome) {
            this.account = new AccountResponse(outcome.getAccount());
            this.transaction = new TransactionResponse(outcome.getTransaction());
            this.replayed = outcome.isReplayed();
        }

        // Getters
        public AccountResponse getAccount() { return account; }
        public TransactionResponse getTransaction() { return transaction; }
        public boolean isReplayed() { return replayed; }
    }

    /**
     * Ledger replay compared with stored totals.
     */
    public static class ReconciliationResponse {
        private String userId;
        private long entryCount;
        private boolean consistent;
        private ReconciliationReport.Totals stored;
        private ReconciliationReport.Totals replayed;
        private List<String> discrepancies;

        public ReconciliationResponse(ReconciliationReport report) {
            this.userId = report.userId();
            this.entryCount = report.entryCount();
            this.consistent = report.isConsistent();
            this.stored = report.stored();
            this.replayed = report.replayed();
            this.discrepancies = report.discrepancies();
        }

        // Getters
        public String getUserId() { return userId; }
        public long getEntryCount() { return entryCount; }
        public boolean isConsistent() { return consistent; }
        public ReconciliationReport.Totals getStored() { return stored; }
        public ReconciliationReport.Totals getReplayed() { return replayed; }
        public List<String> getDiscrepancies() { return discrepancies; }
    }

    /**
     * Error response.
     */
    public static class ErrorResponse {
        private String error;
        private String message;
        private Instant timestamp;

        public ErrorResponse(String error, String message) {
            this.error = error;
            this.message = message;
            this.timestamp = Instant.now();
        }

        // Getters
        public String getError() { return error; }
        public String getMessage() { return message; }
        public Instant getTimestamp() { return timestamp; }
    }
}
