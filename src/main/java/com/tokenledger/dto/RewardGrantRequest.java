package com.tokenledger.dto;

import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * DTO for crediting a catalogued earning activity.
 * Both fields are optional: a missing amount means the activity's default.
 */
public class RewardGrantRequest {

    private BigDecimal amount;

    @Size(max = 255, message = "Reference ID must be at most 255 characters")
    private String referenceId;

    public RewardGrantRequest() {
    }

    public RewardGrantRequest(BigDecimal amount, String referenceId) {
        this.amount = amount;
        this.referenceId = referenceId;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public void setAmount(BigDecimal amount) {
        this.amount = amount;
    }

    public String getReferenceId() {
        return referenceId;
    }

    public void setReferenceId(String referenceId) {
        this.referenceId = referenceId;
    }
}
