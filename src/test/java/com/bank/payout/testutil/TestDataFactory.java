package com.bank.payout.testutil;

import com.bank.payout.config.AutomationConfig;
import com.bank.payout.model.*;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    // Wednesday 2024-05-15 10:00 UTC
    public static final long NOW = Instant.parse("2024-05-15T10:00:00Z").toEpochMilli();

    public static final String WALLET = "0x9f2c4e1b7a3d5c6e8f0a1b2c3d4e5f6a7b8c9d0e";

    private TestDataFactory() {}

    public static Clock fixedClock() {
        return Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC);
    }

    public static AutomationConfig automationConfig() {
        AutomationConfig config = new AutomationConfig();
        config.setFullThreshold(75.0);
        config.setPartialThreshold(50.0);
        config.validate();
        return config;
    }

    public static MerchantRiskScore createRiskScore(String merchantId, AutomationLevel level) {
        AutomationConfig.LevelLimits limits = automationConfig().limitsFor(level);
        double overall = switch (level) {
            case FULL -> 85.0;
            case PARTIAL -> 60.0;
            case MANUAL_REVIEW -> 30.0;
        };
        return MerchantRiskScore.builder()
                .merchantId(merchantId)
                .transactionHistoryScore(overall * 0.25)
                .chargebackRateScore(overall * 0.25)
                .accountAgeScore(overall * 0.15)
                .verificationLevelScore(overall * 0.15)
                .recentActivityScore(overall * 0.20)
                .overallScore(overall)
                .automationLevel(level)
                .dailyLimit(limits.getDaily())
                .weeklyLimit(limits.getWeekly())
                .monthlyLimit(limits.getMonthly())
                .singleTransactionLimit(limits.getSingleTransaction())
                .requiresApprovalAbove(limits.getRequiresApprovalAbove())
                .active(true)
                .createdAt(NOW - 86_400_000L)
                .lastUpdated(NOW - 86_400_000L)
                .updatedBy("SYSTEM")
                .build();
    }

    public static PayoutCandidate createCandidate(String merchantId, String amount) {
        return createCandidate(merchantId, amount, ScheduleType.SCHEDULED);
    }

    public static PayoutCandidate createCandidate(String merchantId, String amount, ScheduleType scheduleType) {
        return PayoutCandidate.builder()
                .merchantId(merchantId)
                .amount(new BigDecimal(amount))
                .currency("TAIC")
                .destinationWallet(WALLET)
                .destinationNetwork("FANTOM")
                .scheduleType(scheduleType)
                .build();
    }

    public static PayoutRequest createPendingRequest(String id, String merchantId, String amount) {
        BigDecimal value = new BigDecimal(amount);
        return PayoutRequest.builder()
                .id(id)
                .merchantId(merchantId)
                .amount(value)
                .currency("TAIC")
                .destinationWallet(WALLET)
                .destinationNetwork(DestinationNetwork.FANTOM)
                .scheduleType(ScheduleType.SCHEDULED)
                .scheduledFor(NOW - 60_000L)
                .priority(PayoutPriority.NORMAL)
                .status(PayoutStatus.PENDING)
                .riskScoreAtDecision(85.0)
                .automationLevelAtDecision(AutomationLevel.FULL)
                .automationDecision(DecisionOutcome.AUTO_APPROVE)
                .decisionReasons(List.of("full automation within limits"))
                .approved(true)
                .processingAttempts(0)
                .maxAttempts(3)
                .nextAttemptAt(0L)
                .idempotencyKey("orig:" + id)
                .originalRequestId(id)
                .reservedAt(NOW - 60_000L)
                .metadata(Map.of())
                .createdAt(NOW - 60_000L)
                .updatedAt(NOW - 60_000L)
                .version(1)
                .build();
    }

    public static PayoutRequest createReviewRequest(String id, String merchantId, String amount) {
        return createPendingRequest(id, merchantId, amount).toBuilder()
                .automationDecision(DecisionOutcome.MANUAL_REVIEW)
                .decisionReasons(List.of("exceeds approval threshold"))
                .approved(false)
                .reservedAt(null)
                .build();
    }

    public static PayoutRequest createProcessingRequest(String id, String merchantId, String amount) {
        return createPendingRequest(id, merchantId, amount).toBuilder()
                .status(PayoutStatus.PROCESSING)
                .processingStartedAt(NOW)
                .claimedBy("worker-test")
                .version(2)
                .build();
    }

    public static MerchantSignals createSignals(String merchantId, long totalOrders, String totalRevenue,
                                               long disputedOrders, long accountAgeDays,
                                               VerificationTier tier, long recentOrders) {
        return MerchantSignals.builder()
                .merchantId(merchantId)
                .totalOrders(totalOrders)
                .totalRevenue(new BigDecimal(totalRevenue))
                .cancelledOrders(0)
                .disputedOrders(disputedOrders)
                .accountCreatedAt(NOW - accountAgeDays * 86_400_000L)
                .verificationTier(tier)
                .recentOrders(recentOrders)
                .recentRevenue(BigDecimal.ZERO)
                .build();
    }

    public static LedgerSnapshot emptyLedger(String merchantId) {
        return LedgerSnapshot.empty(merchantId, NOW);
    }

    public static LedgerSnapshot ledgerWithDailyConsumption(String merchantId, String consumed) {
        BigDecimal amount = new BigDecimal(consumed);
        return new LedgerSnapshot(merchantId, NOW, Map.of(
                LimitWindow.DAY, amount,
                LimitWindow.WEEK, amount,
                LimitWindow.MONTH, amount));
    }
}
