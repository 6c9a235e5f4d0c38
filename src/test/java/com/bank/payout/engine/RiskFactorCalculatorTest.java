package com.bank.payout.engine;

import com.bank.payout.model.MerchantRiskScore;
import com.bank.payout.model.MerchantSignals;
import com.bank.payout.model.VerificationTier;
import com.bank.payout.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import static com.bank.payout.testutil.TestDataFactory.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RiskFactorCalculatorTest {

    private final RiskFactorCalculator calculator = new RiskFactorCalculator();

    @Test
    void establishedMerchant_scoresAtEveryCeiling() {
        MerchantSignals signals = TestDataFactory.createSignals("M-1", 500, "120000", 0, 400,
                VerificationTier.ENHANCED, 80);

        MerchantRiskScore score = calculator.score(signals, NOW);

        assertThat(score.getTransactionHistoryScore()).isEqualTo(25.0);
        assertThat(score.getChargebackRateScore()).isEqualTo(25.0);
        assertThat(score.getAccountAgeScore()).isEqualTo(15.0);
        assertThat(score.getVerificationLevelScore()).isEqualTo(15.0);
        assertThat(score.getRecentActivityScore()).isEqualTo(20.0);
        assertThat(score.getOverallScore()).isEqualTo(100.0);
    }

    @Test
    void overallScore_isSumOfFactors() {
        MerchantSignals signals = TestDataFactory.createSignals("M-1", 40, "10000", 1, 45,
                VerificationTier.BASIC, 8);

        MerchantRiskScore score = calculator.score(signals, NOW);

        double sum = score.getTransactionHistoryScore() + score.getChargebackRateScore()
                + score.getAccountAgeScore() + score.getVerificationLevelScore() + score.getRecentActivityScore();
        assertThat(score.getOverallScore()).isCloseTo(sum, within(0.05));
        assertThat(score.getOverallScore()).isBetween(0.0, 100.0);
    }

    @Test
    void chargebackRate_fewOrders_isConservative() {
        MerchantSignals signals = TestDataFactory.createSignals("M-1", 5, "100", 0, 400,
                VerificationTier.STANDARD, 5);

        assertThat(calculator.chargebackRate(signals)).isEqualTo(10.0);
    }

    @Test
    void chargebackRate_fallsToZeroAtFivePercentDisputes() {
        MerchantSignals clean = TestDataFactory.createSignals("M-1", 100, "100", 0, 400, VerificationTier.NONE, 0);
        MerchantSignals some = TestDataFactory.createSignals("M-1", 100, "100", 2, 400, VerificationTier.NONE, 0);
        MerchantSignals bad = TestDataFactory.createSignals("M-1", 100, "100", 8, 400, VerificationTier.NONE, 0);

        assertThat(calculator.chargebackRate(clean)).isEqualTo(25.0);
        assertThat(calculator.chargebackRate(some)).isEqualTo(15.0);
        assertThat(calculator.chargebackRate(bad)).isEqualTo(0.0);
    }

    @Test
    void transactionHistory_penalisesCancellations() {
        MerchantSignals signals = TestDataFactory.createSignals("M-1", 100, "50000", 0, 400,
                VerificationTier.NONE, 0);
        signals.setCancelledOrders(20);

        assertThat(calculator.transactionHistory(signals)).isEqualTo(23.0);
    }

    @Test
    void accountAge_usesBands() {
        assertThat(calculator.accountAge(signalsAged(3), NOW)).isEqualTo(0.0);
        assertThat(calculator.accountAge(signalsAged(10), NOW)).isEqualTo(4.0);
        assertThat(calculator.accountAge(signalsAged(60), NOW)).isEqualTo(8.0);
        assertThat(calculator.accountAge(signalsAged(120), NOW)).isEqualTo(11.0);
        assertThat(calculator.accountAge(signalsAged(200), NOW)).isEqualTo(13.0);
        assertThat(calculator.accountAge(signalsAged(365), NOW)).isEqualTo(15.0);
    }

    @Test
    void accountAge_unknownCreationTime_countsAsNewAccount() {
        MerchantSignals signals = TestDataFactory.createSignals("M-1", 500, "120000", 0, 400,
                VerificationTier.ENHANCED, 80);
        signals.setAccountCreatedAt(null);

        MerchantRiskScore score = calculator.score(signals, NOW);

        assertThat(score.getAccountAgeScore()).isEqualTo(0.0);
        assertThat(score.getOverallScore()).isEqualTo(85.0);
        assertThat(RiskFactorCalculator.accountAgeDays(null, NOW)).isZero();
        assertThat(RiskFactorCalculator.accountAgeDays(0L, NOW)).isZero();
    }

    @Test
    void accountAge_creationTimeInFuture_scoresZero() {
        MerchantSignals signals = signalsAged(0);
        signals.setAccountCreatedAt(NOW + 86_400_000L);

        assertThat(calculator.accountAge(signals, NOW)).isEqualTo(0.0);
    }

    @Test
    void recentActivity_isMonotonic() {
        double previous = -1;
        for (long orders : new long[]{0, 3, 10, 30, 60}) {
            double points = calculator.recentActivity(
                    TestDataFactory.createSignals("M-1", 0, "0", 0, 0, VerificationTier.NONE, orders));
            assertThat(points).isGreaterThan(previous);
            previous = points;
        }
    }

    @Test
    void verificationLevel_missingTierScoresZero() {
        MerchantSignals signals = TestDataFactory.createSignals("M-1", 0, "0", 0, 0, null, 0);

        assertThat(calculator.verificationLevel(signals)).isEqualTo(0.0);
    }

    @Test
    void newMerchantDefault_scoresFifty() {
        MerchantRiskScore score = calculator.newMerchantDefault("M-NEW");

        assertThat(score.getMerchantId()).isEqualTo("M-NEW");
        assertThat(score.getOverallScore()).isEqualTo(50.0);
    }

    private static MerchantSignals signalsAged(long days) {
        return TestDataFactory.createSignals("M-1", 0, "0", 0, days, VerificationTier.NONE, 0);
    }
}
