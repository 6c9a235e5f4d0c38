package com.bank.payout.exception;

/**
 * The engine-wide emergency halt is active.
 */
public class EmergencyHaltException extends PayoutException {

    public EmergencyHaltException(String message) {
        super(message);
    }
}
