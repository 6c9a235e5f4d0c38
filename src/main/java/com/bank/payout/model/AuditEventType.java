package com.bank.payout.model;

public enum AuditEventType {
    PAYOUT_CREATED,
    AUTOMATION_DECISION,
    PAYOUT_CLAIMED,
    CLAIM_REVERTED,
    PAYOUT_EXECUTED,
    PAYOUT_RETRY_SCHEDULED,
    PAYOUT_FAILED,
    PAYOUT_HELD_TREASURY_HALT,
    PAYOUT_CANCELLED,
    PROCESS_REQUESTED,
    MANUAL_OVERRIDE_APPROVED,
    MANUAL_OVERRIDE_REJECTED,
    STUCK_REQUEST_RECOVERED,
    TRANSITION_ABORTED,
    IDEMPOTENCY_CONFLICT,
    RISK_SCORE_CREATED,
    RISK_SCORE_RECALCULATED,
    RISK_SCORE_UPDATED,
    RISK_SCORE_FAIL_CLOSED,
    BULK_RISK_UPDATE,
    EMERGENCY_HALT,
    PROCESSING_RESUMED,
    CONFIG_UPDATED
}
