package com.bank.payout.exception;

/**
 * Malformed candidate, rejected before admission and never queued.
 */
public class ValidationException extends PayoutException {

    public ValidationException(String message) {
        super(message);
    }
}
