package com.bank.payout.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "An automated payout request and its lifecycle state")
public class PayoutRequest {

    private String id;
    private String merchantId;
    private BigDecimal amount;
    private String currency;
    private String destinationWallet;
    private DestinationNetwork destinationNetwork;
    private ScheduleType scheduleType;
    private long scheduledFor;
    private PayoutPriority priority;
    private PayoutStatus status;

    @Schema(description = "Overall risk score snapshotted when the decision was taken")
    private double riskScoreAtDecision;
    private AutomationLevel automationLevelAtDecision;
    private DecisionOutcome automationDecision;
    private List<String> decisionReasons;

    @Schema(description = "Cleared for dispatch, either automatically or by an operator")
    private boolean approved;
    private String reviewedBy;
    private Long reviewedAt;

    private int processingAttempts;
    private int maxAttempts;
    private Long lastAttemptAt;
    @Schema(description = "Not eligible for dispatch before this time (retry backoff)")
    private long nextAttemptAt;
    private Long processingStartedAt;
    private String claimedBy;

    private Long executedAt;
    private String transactionHash;
    private String treasuryTransactionId;
    private String failureReason;

    private String idempotencyKey;
    private String originalRequestId;

    @Schema(description = "Window anchor of the open ledger reservation; null when none is held")
    private Long reservedAt;

    private Map<String, String> metadata;
    private long createdAt;
    private long updatedAt;

    @Schema(description = "Store version used for compare-and-set")
    private int version;

    public boolean isAwaitingReview() {
        return status == PayoutStatus.PENDING && !approved;
    }

    public boolean isEligibleAt(long now) {
        return status == PayoutStatus.PENDING && approved
                && scheduledFor <= now && nextAttemptAt <= now;
    }
}
