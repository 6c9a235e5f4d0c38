package com.bank.payout.exception;

/**
 * Merchant signal source could not be read. Scoring fails closed to MANUAL_REVIEW.
 */
public class RiskDataUnavailableException extends PayoutException {

    public RiskDataUnavailableException(String message) {
        super(message);
    }

    public RiskDataUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
