package com.bank.payout.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of an automated payout request.
 *
 * PENDING covers three situations that the queue tells apart by other fields:
 * approved and waiting for dispatch, awaiting manual review, and waiting out a retry backoff.
 */
public enum PayoutStatus {
    PENDING,
    PROCESSING,
    EXECUTED,
    FAILED,
    REJECTED,
    CANCELLED;

    public boolean isTerminal() {
        return this == EXECUTED || this == FAILED || this == REJECTED || this == CANCELLED;
    }

    public boolean canTransitionTo(PayoutStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<PayoutStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(PENDING, PROCESSING, REJECTED, CANCELLED);
            case PROCESSING -> EnumSet.of(PENDING, EXECUTED, FAILED);
            case EXECUTED, FAILED, REJECTED, CANCELLED -> EnumSet.noneOf(PayoutStatus.class);
        };
    }
}
