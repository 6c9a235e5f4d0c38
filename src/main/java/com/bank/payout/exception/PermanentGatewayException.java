package com.bank.payout.exception;

/**
 * Treasury rejected the transfer for good (bad address, compliance block).
 */
public class PermanentGatewayException extends PayoutException {

    public PermanentGatewayException(String message) {
        super(message);
    }

    public PermanentGatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
