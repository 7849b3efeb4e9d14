package com.tokenledger.exception;

import com.tokenledger.service.RejectionReason;

/**
 * Carries a processor rejection across the HTTP boundary.
 *
 * The ledger core returns rejections as values; controllers convert them into
 * this exception so GlobalExceptionHandler can render one error shape.
 */
public class TransactionRejectedException extends RuntimeException {

    private final RejectionReason reason;

    public TransactionRejectedException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public RejectionReason getReason() {
        return reason;
    }
}
