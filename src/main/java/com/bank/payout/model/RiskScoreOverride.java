package com.bank.payout.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Partial update of a merchant risk score. Null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Operator override of a merchant risk score; null fields are left unchanged")
public class RiskScoreOverride {

    private Double transactionHistoryScore;
    private Double chargebackRateScore;
    private Double accountAgeScore;
    private Double verificationLevelScore;
    private Double recentActivityScore;

    @Schema(description = "Pins the automation level instead of deriving it from the score")
    private AutomationLevel automationLevel;

    private BigDecimal dailyLimit;
    private BigDecimal weeklyLimit;
    private BigDecimal monthlyLimit;
    private BigDecimal singleTransactionLimit;
    private BigDecimal requiresApprovalAbove;

    private Boolean payoutsHalted;
    private Boolean active;

    @Schema(description = "Free-text justification recorded in the audit trail")
    private String reason;
}
