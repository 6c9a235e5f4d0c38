package com.bank.payout.model;

public enum ScheduleType {
    SCHEDULED,
    THRESHOLD_TRIGGERED,
    REAL_TIME,
    MANUAL_OVERRIDE
}
