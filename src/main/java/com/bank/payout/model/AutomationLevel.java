package com.bank.payout.model;

/**
 * How much of a merchant's payout flow may bypass human review.
 * Ordinal order is from most to least automated.
 */
public enum AutomationLevel {
    FULL,
    PARTIAL,
    MANUAL_REVIEW;

    public static AutomationLevel fromScore(double overallScore, double fullThreshold, double partialThreshold) {
        if (overallScore >= fullThreshold) return FULL;
        if (overallScore >= partialThreshold) return PARTIAL;
        return MANUAL_REVIEW;
    }
}
