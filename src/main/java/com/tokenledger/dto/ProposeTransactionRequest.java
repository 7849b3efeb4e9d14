package com.tokenledger.dto;

import com.tokenledger.domain.TransactionType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * DTO for a generic transaction proposal.
 *
 * The amount is only checked for presence here; its sign and scale are
 * judged by the processor, which answers INVALID_AMOUNT.
 */
public class ProposeTransactionRequest {

    @NotNull(message = "Transaction type is required")
    private TransactionType type;

    @NotNull(message = "Amount is required")
    private BigDecimal amount;

    @NotBlank(message = "Source is required")
    @Size(max = 64, message = "Source must be at most 64 characters")
    private String source;

    @Size(max = 500, message = "Description must be at most 500 characters")
    private String description;

    @Size(max = 255, message = "Reference ID must be at most 255 characters")
    private String referenceId;

    // Constructors
    public ProposeTransactionRequest() {
    }

    public ProposeTransactionRequest(TransactionType type, BigDecimal amount, String source,
                                     String description, String referenceId) {
        this.type = type;
        this.amount = amount;
        this.source = source;
        this.description = description;
        this.referenceId = referenceId;
    }

    // Getters and Setters
    public TransactionType getType() {
        return type;
    }

    public void setType(TransactionType type) {
        this.type = type;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public void setAmount(BigDecimal amount) {
        this.amount = amount;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getReferenceId() {
        return referenceId;
    }

    public void setReferenceId(String referenceId) {
        this.referenceId = referenceId;
    }
}
