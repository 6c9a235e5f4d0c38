package com.bank.payout.model;

public enum PayoutPriority {
    LOW(0),
    NORMAL(1),
    HIGH(2),
    URGENT(3);

    private final int rank;

    PayoutPriority(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    public static PayoutPriority defaultFor(ScheduleType scheduleType) {
        return switch (scheduleType) {
            case REAL_TIME -> URGENT;
            case MANUAL_OVERRIDE -> HIGH;
            case SCHEDULED, THRESHOLD_TRIGGERED -> NORMAL;
        };
    }
}
