package com.bank.payout.exception;

/**
 * Retryable treasury failure, bounded by maxAttempts.
 */
public class TransientGatewayException extends PayoutException {

    public TransientGatewayException(String message) {
        super(message);
    }

    public TransientGatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
