package com.bank.payout.exception;

/**
 * Requested lifecycle transition is not legal from the current state.
 */
public class IllegalTransitionException extends PayoutException {

    public IllegalTransitionException(String message) {
        super(message);
    }
}
