package com.bank.payout.exception;

import com.bank.payout.model.PayoutRequest;

/**
 * A terminal request was submitted for processing again. Carries the original outcome.
 */
public class IdempotencyConflictException extends PayoutException {

    private final PayoutRequest original;

    public IdempotencyConflictException(PayoutRequest original) {
        super("Payout " + original.getId() + " is already " + original.getStatus());
        this.original = original;
    }

    public PayoutRequest getOriginal() {
        return original;
    }
}
