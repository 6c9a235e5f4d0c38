package com.bank.payout.model;

public enum BatchReviewAction {
    APPROVE,
    REJECT
}
