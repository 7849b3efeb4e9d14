package com.tokenledger.controller;

import com.tokenledger.dto.ApiResponses;
import com.tokenledger.exception.TransactionRejectedException;
import com.tokenledger.service.TransactionOutcome;
import org.springframework.http.ResponseEntity;

/**
 * Maps processor outcomes to HTTP: accepted → 200 with the result,
 * rejected → TransactionRejectedException for GlobalExceptionHandler.
 */
final class OutcomeResponses {

    private OutcomeResponses() {
    }

    static ResponseEntity<ApiResponses.TransactionResultResponse> toResponse(TransactionOutcome outcome) {
        if (outcome.isRejected()) {
            throw new TransactionRejectedException(outcome.getRejection(), outcome.getMessage());
        }
        return ResponseEntity.ok(new ApiResponses.TransactionResultResponse(outcome));
    }
}
