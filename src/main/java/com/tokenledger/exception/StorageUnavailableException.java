package com.tokenledger.exception;

/**
 * The ledger store could not be reached or did not answer in time.
 *
 * Raised for connection loss, transactions that cannot be opened and lock
 * waits that time out. The core never retries; callers own the retry policy.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
