package com.bank.payout.exception;

/**
 * Root of the payout engine's error taxonomy.
 */
public class PayoutException extends RuntimeException {

    public PayoutException(String message) {
        super(message);
    }

    public PayoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
