package com.bank.payout.exception;

public class NotFoundException extends PayoutException {

    public NotFoundException(String message) {
        super(message);
    }
}
