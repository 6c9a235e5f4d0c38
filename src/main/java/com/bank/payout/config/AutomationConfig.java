package com.bank.payout.config;

import com.bank.payout.exception.ConfigurationException;
import com.bank.payout.model.AutomationLevel;
import com.bank.payout.support.MinorUnits;
import jakarta.annotation.PostConstruct;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Data
@Configuration
@ConfigurationProperties(prefix = "payout.automation")
public class AutomationConfig {

    // Overall score at or above which a merchant is fully automated. Required, no default.
    private Double fullThreshold;

    // Overall score at or above which a merchant is partially automated. Required, no default.
    private Double partialThreshold;

    // PARTIAL merchants auto-approve up to this fraction of their single transaction limit.
    private double partialAutoApproveFraction = 0.5;

    // Base limits per automation level, before any operator override.
    private Map<AutomationLevel, LevelLimits> baseLimits = defaultBaseLimits();

    private int maxAttempts = 3;

    private Retry retry = new Retry();

    private Dispatch dispatch = new Dispatch();

    // PROCESSING requests older than this are returned to PENDING by the recovery job.
    private long stuckProcessingTimeoutMinutes = 30;

    private long stuckCheckIntervalMs = 60_000;

    private List<String> supportedCurrencies = new ArrayList<>(List.of("TAIC"));

    private String defaultCurrency = "TAIC";

    // Compliance denylist, compared case-insensitively.
    private Set<String> denylistedWallets = new HashSet<>();

    private String recalculationCron = "0 0 3 * * *";

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LevelLimits {
        private BigDecimal daily;
        private BigDecimal weekly;
        private BigDecimal monthly;
        private BigDecimal singleTransaction;
        private BigDecimal requiresApprovalAbove;
    }

    @Data
    public static class Retry {
        private long baseDelayMs = 1000;
        private long maxDelayMs = 10000;
        private double multiplier = 2.0;
        // A request held by a treasury halt is not retried before this delay. No attempt is spent.
        private long treasuryHaltHoldMs = 30_000;
    }

    @Data
    public static class Dispatch {
        private boolean enabled = true;
        private long pollIntervalMs = 2000;
        private long initialDelayMs = 5000;
        private int workerPoolSize = 8;
        private int leaseTtlSeconds = 120;
        private long ledgerLeaseWaitMs = 2000;
    }

    public LevelLimits limitsFor(AutomationLevel level) {
        return baseLimits.get(level);
    }

    public boolean isDenylisted(String wallet) {
        if (wallet == null) return false;
        return denylistedWallets.stream().anyMatch(w -> w.equalsIgnoreCase(wallet.trim()));
    }

    @PostConstruct
    public void validate() {
        if (fullThreshold == null || partialThreshold == null) {
            throw new ConfigurationException(
                    "payout.automation.full-threshold and payout.automation.partial-threshold must be set");
        }
        if (partialThreshold < 0 || fullThreshold > 100 || partialThreshold >= fullThreshold) {
            throw new ConfigurationException("Automation thresholds must satisfy 0 <= partial < full <= 100, got partial="
                    + partialThreshold + " full=" + fullThreshold);
        }
        if (partialAutoApproveFraction <= 0 || partialAutoApproveFraction > 1) {
            throw new ConfigurationException("payout.automation.partial-auto-approve-fraction must be in (0, 1]");
        }
        if (maxAttempts < 1) {
            throw new ConfigurationException("payout.automation.max-attempts must be >= 1");
        }
        if (retry.getBaseDelayMs() <= 0 || retry.getMaxDelayMs() < retry.getBaseDelayMs() || retry.getMultiplier() < 1
                || retry.getTreasuryHaltHoldMs() <= 0) {
            throw new ConfigurationException("payout.automation.retry is inconsistent: " + retry);
        }
        if (supportedCurrencies == null || supportedCurrencies.isEmpty()) {
            throw new ConfigurationException("payout.automation.supported-currencies must not be empty");
        }
        for (AutomationLevel level : AutomationLevel.values()) {
            LevelLimits limits = baseLimits.get(level);
            if (limits == null || limits.getDaily() == null || limits.getWeekly() == null
                    || limits.getMonthly() == null || limits.getSingleTransaction() == null
                    || limits.getRequiresApprovalAbove() == null) {
                throw new ConfigurationException("payout.automation.base-limits." + level + " is incomplete");
            }
            if (!MinorUnits.fits(limits.getDaily()) || !MinorUnits.fits(limits.getWeekly())
                    || !MinorUnits.fits(limits.getMonthly()) || !MinorUnits.fits(limits.getSingleTransaction())
                    || !MinorUnits.fits(limits.getRequiresApprovalAbove())) {
                throw new ConfigurationException("payout.automation.base-limits." + level
                        + " must not exceed " + MinorUnits.MAX_AMOUNT.toPlainString());
            }
        }
        requireMonotonic(AutomationLevel.FULL, AutomationLevel.PARTIAL);
        requireMonotonic(AutomationLevel.PARTIAL, AutomationLevel.MANUAL_REVIEW);
    }

    private void requireMonotonic(AutomationLevel higher, AutomationLevel lower) {
        LevelLimits h = baseLimits.get(higher);
        LevelLimits l = baseLimits.get(lower);
        if (h.getDaily().compareTo(l.getDaily()) < 0
                || h.getWeekly().compareTo(l.getWeekly()) < 0
                || h.getMonthly().compareTo(l.getMonthly()) < 0
                || h.getSingleTransaction().compareTo(l.getSingleTransaction()) < 0
                || h.getRequiresApprovalAbove().compareTo(l.getRequiresApprovalAbove()) < 0) {
            throw new ConfigurationException("Base limits of " + higher + " must not be below those of " + lower);
        }
    }

    private static Map<AutomationLevel, LevelLimits> defaultBaseLimits() {
        Map<AutomationLevel, LevelLimits> limits = new EnumMap<>(AutomationLevel.class);
        limits.put(AutomationLevel.FULL, new LevelLimits(new BigDecimal("10000"), new BigDecimal("50000"),
                new BigDecimal("200000"), new BigDecimal("5000"), new BigDecimal("10000")));
        limits.put(AutomationLevel.PARTIAL, new LevelLimits(new BigDecimal("5000"), new BigDecimal("25000"),
                new BigDecimal("100000"), new BigDecimal("2500"), new BigDecimal("5000")));
        limits.put(AutomationLevel.MANUAL_REVIEW, new LevelLimits(new BigDecimal("1000"), new BigDecimal("5000"),
                new BigDecimal("20000"), new BigDecimal("500"), new BigDecimal("1000")));
        return limits;
    }
}
