package com.bank.payout.exception;

/**
 * Treasury is under its own emergency halt. Requests are held at PENDING.
 */
public class TreasuryHaltedException extends PayoutException {

    public TreasuryHaltedException(String message) {
        super(message);
    }
}
