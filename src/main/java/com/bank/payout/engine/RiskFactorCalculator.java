package com.bank.payout.engine;

import com.bank.payout.model.MerchantRiskScore;
import com.bank.payout.model.MerchantSignals;
import com.bank.payout.model.VerificationTier;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Maps raw merchant signals onto the five weighted sub-factors.
 *
 * Every mapping is monotonic in its input and clamped to the factor's ceiling, so the
 * overall score is always the plain sum of the factors and stays within 0-100.
 */
@Component
public class RiskFactorCalculator {

    static final long ORDER_PLATEAU = 100;
    static final BigDecimal REVENUE_PLATEAU = new BigDecimal("50000");
    static final double DISPUTE_RATE_ZERO_POINTS = 0.05;
    static final long MIN_ORDERS_FOR_DISPUTE_RATE = 10;
    static final double CONSERVATIVE_CHARGEBACK_POINTS = 10.0;

    private static final long DAY_MS = 24L * 60 * 60 * 1000;

    /**
     * Factors and overall score only; automation level and limits are applied by the caller.
     */
    public MerchantRiskScore score(MerchantSignals signals, long now) {
        MerchantRiskScore score = MerchantRiskScore.builder()
                .merchantId(signals.getMerchantId())
                .transactionHistoryScore(transactionHistory(signals))
                .chargebackRateScore(chargebackRate(signals))
                .accountAgeScore(accountAge(signals, now))
                .verificationLevelScore(verificationLevel(signals))
                .recentActivityScore(recentActivity(signals))
                .build();
        score.resum();
        return score;
    }

    /**
     * Score given to merchants the platform has no history for: 12/12/8/8/10, overall 50.
     */
    public MerchantRiskScore newMerchantDefault(String merchantId) {
        MerchantRiskScore score = MerchantRiskScore.builder()
                .merchantId(merchantId)
                .transactionHistoryScore(12.0)
                .chargebackRateScore(12.0)
                .accountAgeScore(8.0)
                .verificationLevelScore(8.0)
                .recentActivityScore(10.0)
                .build();
        score.resum();
        return score;
    }

    double transactionHistory(MerchantSignals s) {
        double orders = Math.min(1.0, (double) s.getTotalOrders() / ORDER_PLATEAU) * 15.0;
        double revenue = 0.0;
        if (s.getTotalRevenue() != null && s.getTotalRevenue().signum() > 0) {
            revenue = Math.min(1.0, s.getTotalRevenue().doubleValue() / REVENUE_PLATEAU.doubleValue()) * 10.0;
        }
        double cancellationPenalty = 0.0;
        if (s.getTotalOrders() > 0) {
            double ratio = (double) s.getCancelledOrders() / s.getTotalOrders();
            cancellationPenalty = Math.min(5.0, ratio * 10.0);
        }
        return MerchantRiskScore.clamp(orders + revenue - cancellationPenalty,
                MerchantRiskScore.TRANSACTION_HISTORY_CEILING);
    }

    double chargebackRate(MerchantSignals s) {
        if (s.getTotalOrders() < MIN_ORDERS_FOR_DISPUTE_RATE) {
            return CONSERVATIVE_CHARGEBACK_POINTS;
        }
        double rate = (double) s.getDisputedOrders() / s.getTotalOrders();
        double points = MerchantRiskScore.CHARGEBACK_RATE_CEILING * (1.0 - rate / DISPUTE_RATE_ZERO_POINTS);
        return MerchantRiskScore.clamp(points, MerchantRiskScore.CHARGEBACK_RATE_CEILING);
    }

    double accountAge(MerchantSignals s, long now) {
        long days = accountAgeDays(s.getAccountCreatedAt(), now);
        if (days < 7) return 0.0;
        if (days < 30) return 4.0;
        if (days < 90) return 8.0;
        if (days < 180) return 11.0;
        if (days < 365) return 13.0;
        return MerchantRiskScore.ACCOUNT_AGE_CEILING;
    }

    double verificationLevel(MerchantSignals s) {
        VerificationTier tier = s.getVerificationTier() != null ? s.getVerificationTier() : VerificationTier.NONE;
        return MerchantRiskScore.clamp(tier.getPoints(), MerchantRiskScore.VERIFICATION_LEVEL_CEILING);
    }

    double recentActivity(MerchantSignals s) {
        long orders = s.getRecentOrders();
        if (orders <= 0) return 0.0;
        if (orders < 5) return 5.0;
        if (orders < 20) return 10.0;
        if (orders < 50) return 15.0;
        return MerchantRiskScore.RECENT_ACTIVITY_CEILING;
    }

    /**
     * Whole days since account creation. An unknown or non-positive creation time counts as a new account.
     */
    public static long accountAgeDays(Long accountCreatedAt, long now) {
        if (accountCreatedAt == null || accountCreatedAt <= 0) {
            return 0;
        }
        return Math.max(0, (now - accountCreatedAt) / DAY_MS);
    }
}
