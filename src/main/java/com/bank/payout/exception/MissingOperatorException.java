package com.bank.payout.exception;

/**
 * Mutating call without an operator identity.
 */
public class MissingOperatorException extends PayoutException {

    public MissingOperatorException(String message) {
        super(message);
    }
}
