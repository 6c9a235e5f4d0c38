package com.bank.payout.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Weighted 0-100 merchant trust score with its derived automation level and payout limits")
public class MerchantRiskScore {

    public static final double TRANSACTION_HISTORY_CEILING = 25.0;
    public static final double CHARGEBACK_RATE_CEILING = 25.0;
    public static final double ACCOUNT_AGE_CEILING = 15.0;
    public static final double VERIFICATION_LEVEL_CEILING = 15.0;
    public static final double RECENT_ACTIVITY_CEILING = 20.0;

    @Schema(description = "Merchant identifier", example = "MERCH-001")
    private String merchantId;

    @Schema(description = "Order history points (0-25)")
    private double transactionHistoryScore;

    @Schema(description = "Dispute/chargeback points (0-25), falls as dispute rate rises")
    private double chargebackRateScore;

    @Schema(description = "Account age points (0-15)")
    private double accountAgeScore;

    @Schema(description = "Verification tier points (0-15)")
    private double verificationLevelScore;

    @Schema(description = "Trailing 30-day activity points (0-20)")
    private double recentActivityScore;

    @Schema(description = "Sum of the five sub-factors, 0-100", example = "82.5")
    private double overallScore;

    private AutomationLevel automationLevel;

    private BigDecimal dailyLimit;
    private BigDecimal weeklyLimit;
    private BigDecimal monthlyLimit;
    private BigDecimal singleTransactionLimit;

    @Schema(description = "Amounts above this always go to manual review")
    private BigDecimal requiresApprovalAbove;

    @Schema(description = "Compliance stop: every new payout for this merchant is auto-rejected")
    private boolean payoutsHalted;

    @Schema(description = "Automation level pinned by an operator instead of derived from the score")
    private boolean levelOverridden;

    @Schema(description = "Score was produced while merchant signals were unavailable")
    private boolean failClosed;

    private boolean active;

    private long createdAt;
    private long lastUpdated;
    private String updatedBy;

    public BigDecimal limitFor(LimitWindow window) {
        return switch (window) {
            case DAY -> dailyLimit;
            case WEEK -> weeklyLimit;
            case MONTH -> monthlyLimit;
        };
    }

    /**
     * Recomputes overallScore from the sub-factors after clamping each one to its ceiling.
     */
    public void resum() {
        transactionHistoryScore = clamp(transactionHistoryScore, TRANSACTION_HISTORY_CEILING);
        chargebackRateScore = clamp(chargebackRateScore, CHARGEBACK_RATE_CEILING);
        accountAgeScore = clamp(accountAgeScore, ACCOUNT_AGE_CEILING);
        verificationLevelScore = clamp(verificationLevelScore, VERIFICATION_LEVEL_CEILING);
        recentActivityScore = clamp(recentActivityScore, RECENT_ACTIVITY_CEILING);
        overallScore = round1(transactionHistoryScore + chargebackRateScore + accountAgeScore
                + verificationLevelScore + recentActivityScore);
    }

    public static double clamp(double value, double ceiling) {
        return round1(Math.max(0.0, Math.min(ceiling, value)));
    }

    private static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
