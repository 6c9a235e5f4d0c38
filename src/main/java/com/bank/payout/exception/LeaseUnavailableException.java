package com.bank.payout.exception;

/**
 * A per-merchant lease could not be acquired in time.
 */
public class LeaseUnavailableException extends PayoutException {

    public LeaseUnavailableException(String message) {
        super(message);
    }
}
