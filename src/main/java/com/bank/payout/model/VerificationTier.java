package com.bank.payout.model;

public enum VerificationTier {
    NONE(0),
    BASIC(5),
    STANDARD(10),
    ENHANCED(15);

    private final int points;

    VerificationTier(int points) {
        this.points = points;
    }

    public int getPoints() {
        return points;
    }
}
