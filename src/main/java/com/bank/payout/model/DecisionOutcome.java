package com.bank.payout.model;

public enum DecisionOutcome {
    AUTO_APPROVE,
    AUTO_REJECT,
    MANUAL_REVIEW
}
