package com.tokenledger.exception;

import java.util.NoSuchElementException;

/**
 * Lazy account creation finished without a readable account row.
 */
public class AccountNotFoundException extends NoSuchElementException {

    public AccountNotFoundException(String userId) {
        super("Account not found and could not be created for user: " + userId);
    }
}
