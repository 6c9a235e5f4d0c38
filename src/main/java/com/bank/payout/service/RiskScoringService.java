package com.bank.payout.service;

import com.bank.payout.config.AutomationConfig;
import com.bank.payout.config.MetricsConfig;
import com.bank.payout.engine.RiskFactorCalculator;
import com.bank.payout.exception.RiskDataUnavailableException;
import com.bank.payout.exception.ValidationException;
import com.bank.payout.gateway.MerchantSignalProvider;
import com.bank.payout.model.AuditEntry;
import com.bank.payout.model.AuditEventType;
import com.bank.payout.model.AutomationLevel;
import com.bank.payout.model.BulkRiskUpdate;
import com.bank.payout.model.BulkUpdateResult;
import com.bank.payout.model.MerchantRiskScore;
import com.bank.payout.model.MerchantSignals;
import com.bank.payout.model.MerchantStats;
import com.bank.payout.model.PagedResponse;
import com.bank.payout.model.PayoutRequest;
import com.bank.payout.model.PayoutStatus;
import com.bank.payout.model.RecalculationReport;
import com.bank.payout.model.RiskScoreOverride;
import com.bank.payout.model.RiskScoreSummary;
import com.bank.payout.model.RiskScoreView;
import com.bank.payout.repository.PayoutRequestRepository;
import com.bank.payout.repository.RiskScoreRepository;
import com.bank.payout.support.MinorUnits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Owns the lifecycle of merchant risk scores: first computation, periodic recalculation,
 * operator overrides and bulk adjustments.
 *
 * Scoring fails closed. When merchant signals cannot be read the merchant is stored at
 * MANUAL_REVIEW with all factors at zero, whatever its previous level was.
 */
@Service
public class RiskScoringService {

    private static final Logger log = LoggerFactory.getLogger(RiskScoringService.class);

    public static final String SYSTEM = "SYSTEM";

    static final double HIGH_RISK_BELOW = 30.0;
    static final double LOW_RISK_FROM = 70.0;
    static final int MAX_BULK_MERCHANTS = 100;
    static final double MIN_ADJUSTMENT_FACTOR = 0.1;
    static final double MAX_ADJUSTMENT_FACTOR = 2.0;

    private final RiskScoreRepository scoreRepo;
    private final PayoutRequestRepository payoutRepo;
    private final MerchantSignalProvider signalProvider;
    private final RiskFactorCalculator calculator;
    private final AutomationConfig config;
    private final AuditTrailService auditTrail;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public RiskScoringService(RiskScoreRepository scoreRepo,
                              PayoutRequestRepository payoutRepo,
                              MerchantSignalProvider signalProvider,
                              RiskFactorCalculator calculator,
                              AutomationConfig config,
                              AuditTrailService auditTrail,
                              MetricsConfig metricsConfig,
                              Clock clock) {
        this.scoreRepo = scoreRepo;
        this.payoutRepo = payoutRepo;
        this.signalProvider = signalProvider;
        this.calculator = calculator;
        this.config = config;
        this.auditTrail = auditTrail;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Stored score, or a freshly computed and persisted one for a merchant seen for the first time.
     */
    public MerchantRiskScore computeRiskScore(String merchantId) {
        return scoreRepo.findByMerchantId(merchantId)
                .orElseGet(() -> refreshRiskScore(merchantId, SYSTEM));
    }

    public Optional<MerchantRiskScore> findScore(String merchantId) {
        return scoreRepo.findByMerchantId(merchantId);
    }

    public MerchantRiskScore refreshRiskScore(String merchantId) {
        return refreshRiskScore(merchantId, SYSTEM);
    }

    public MerchantRiskScore refreshRiskScore(String merchantId, String performedBy) {
        Optional<MerchantRiskScore> existing = scoreRepo.findByMerchantId(merchantId);
        long now = clock.millis();

        Optional<MerchantSignals> signals;
        try {
            signals = signalProvider.fetchSignals(merchantId);
        } catch (RiskDataUnavailableException e) {
            return failClosed(merchantId, existing.orElse(null), performedBy, e.getMessage());
        }

        MerchantRiskScore score;
        if (signals.isPresent()) {
            score = calculator.score(signals.get(), now);
            score.setMerchantId(merchantId);
            applyDerivedLevel(score, existing.orElse(null));
        } else {
            score = calculator.newMerchantDefault(merchantId);
            AutomationLevel derived = deriveLevel(score.getOverallScore());
            applyLevel(score, derived == AutomationLevel.FULL ? AutomationLevel.PARTIAL : derived);
            existing.filter(MerchantRiskScore::isLevelOverridden).ifPresent(pinned -> keepPinnedLevel(score, pinned));
        }

        score.setPayoutsHalted(existing.map(MerchantRiskScore::isPayoutsHalted).orElse(false));
        score.setActive(existing.map(MerchantRiskScore::isActive).orElse(true));
        score.setCreatedAt(existing.map(MerchantRiskScore::getCreatedAt).orElse(now));
        score.setLastUpdated(now);
        score.setUpdatedBy(performedBy);
        score.setFailClosed(false);

        AuditEventType event = existing.isPresent() ? AuditEventType.RISK_SCORE_RECALCULATED : AuditEventType.RISK_SCORE_CREATED;
        Map<String, Object> details = new LinkedHashMap<>(scoreDetails(score));
        details.put("hasHistory", signals.isPresent());
        existing.ifPresent(prev -> details.put("previousOverallScore", prev.getOverallScore()));
        auditTrail.record(event, AuditEntry.ENTITY_MERCHANT, merchantId, performedBy, details);

        scoreRepo.save(score);
        metricsConfig.recordRiskScoreComputed(score.getAutomationLevel().name());
        log.info("Risk score {} for merchant={}: overall={}, level={}",
                existing.isPresent() ? "recalculated" : "created", merchantId,
                score.getOverallScore(), score.getAutomationLevel());
        return score;
    }

    private MerchantRiskScore failClosed(String merchantId, MerchantRiskScore existing, String performedBy, String cause) {
        long now = clock.millis();
        MerchantRiskScore score = MerchantRiskScore.builder()
                .merchantId(merchantId)
                .failClosed(true)
                .payoutsHalted(existing != null && existing.isPayoutsHalted())
                .active(existing == null || existing.isActive())
                .createdAt(existing != null ? existing.getCreatedAt() : now)
                .lastUpdated(now)
                .updatedBy(performedBy)
                .build();
        score.resum();
        applyLevel(score, AutomationLevel.MANUAL_REVIEW);

        Map<String, Object> details = new LinkedHashMap<>(scoreDetails(score));
        details.put("cause", cause != null ? cause : "merchant signals unavailable");
        if (existing != null) {
            details.put("previousAutomationLevel", existing.getAutomationLevel().name());
        }
        auditTrail.record(AuditEventType.RISK_SCORE_FAIL_CLOSED, AuditEntry.ENTITY_MERCHANT, merchantId, performedBy, details);

        scoreRepo.save(score);
        metricsConfig.recordRiskScoreFailClosed();
        log.warn("Risk data unavailable for merchant={}, failing closed to MANUAL_REVIEW: {}", merchantId, cause);
        return score;
    }

    /**
     * Sweeps every active merchant known to the platform plus every stored score.
     * A failure on one merchant is recorded in the report and does not stop the sweep.
     */
    public RecalculationReport recalculateAll(String performedBy) {
        Set<String> merchantIds = new LinkedHashSet<>();
        try {
            merchantIds.addAll(signalProvider.listActiveMerchantIds());
        } catch (RiskDataUnavailableException e) {
            log.warn("Could not list active merchants, recalculating stored scores only: {}", e.getMessage());
        }
        scoreRepo.findAll().stream()
                .filter(MerchantRiskScore::isActive)
                .map(MerchantRiskScore::getMerchantId)
                .forEach(merchantIds::add);

        int processed = 0;
        Map<String, String> failures = new LinkedHashMap<>();
        for (String merchantId : merchantIds) {
            try {
                refreshRiskScore(merchantId, performedBy);
                processed++;
            } catch (RuntimeException e) {
                failures.put(merchantId, e.getMessage());
                log.error("Recalculation failed for merchant={}: {}", merchantId, e.getMessage(), e);
            }
        }

        log.info("Risk score recalculation complete: processed={}, failed={}", processed, failures.size());
        return new RecalculationReport(processed, failures.size(), failures);
    }

    @Scheduled(cron = "${payout.automation.recalculation-cron:0 0 3 * * *}", zone = "UTC")
    public void scheduledRecalculation() {
        recalculateAll(SYSTEM);
    }

    public MerchantRiskScore overrideScore(String merchantId, RiskScoreOverride override, String performedBy) {
        validateOverride(override);
        MerchantRiskScore current = scoreRepo.findByMerchantId(merchantId)
                .orElseGet(() -> refreshRiskScore(merchantId, performedBy));
        Map<String, Object> before = scoreDetails(current);

        MerchantRiskScore updated = current.toBuilder().build();
        boolean factorsChanged = false;
        if (override.getTransactionHistoryScore() != null) {
            updated.setTransactionHistoryScore(override.getTransactionHistoryScore());
            factorsChanged = true;
        }
        if (override.getChargebackRateScore() != null) {
            updated.setChargebackRateScore(override.getChargebackRateScore());
            factorsChanged = true;
        }
        if (override.getAccountAgeScore() != null) {
            updated.setAccountAgeScore(override.getAccountAgeScore());
            factorsChanged = true;
        }
        if (override.getVerificationLevelScore() != null) {
            updated.setVerificationLevelScore(override.getVerificationLevelScore());
            factorsChanged = true;
        }
        if (override.getRecentActivityScore() != null) {
            updated.setRecentActivityScore(override.getRecentActivityScore());
            factorsChanged = true;
        }
        updated.resum();

        if (override.getAutomationLevel() != null) {
            applyLevel(updated, override.getAutomationLevel());
            updated.setLevelOverridden(true);
        } else if (factorsChanged && !updated.isLevelOverridden()) {
            applyLevel(updated, deriveLevel(updated.getOverallScore()));
        }

        if (override.getDailyLimit() != null) updated.setDailyLimit(override.getDailyLimit());
        if (override.getWeeklyLimit() != null) updated.setWeeklyLimit(override.getWeeklyLimit());
        if (override.getMonthlyLimit() != null) updated.setMonthlyLimit(override.getMonthlyLimit());
        if (override.getSingleTransactionLimit() != null) updated.setSingleTransactionLimit(override.getSingleTransactionLimit());
        if (override.getRequiresApprovalAbove() != null) updated.setRequiresApprovalAbove(override.getRequiresApprovalAbove());
        if (override.getPayoutsHalted() != null) updated.setPayoutsHalted(override.getPayoutsHalted());
        if (override.getActive() != null) updated.setActive(override.getActive());

        updated.setFailClosed(false);
        updated.setLastUpdated(clock.millis());
        updated.setUpdatedBy(performedBy);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("before", before);
        details.put("after", scoreDetails(updated));
        if (override.getReason() != null) {
            details.put("reason", override.getReason());
        }
        auditTrail.record(AuditEventType.RISK_SCORE_UPDATED, AuditEntry.ENTITY_MERCHANT, merchantId, performedBy, details);

        scoreRepo.save(updated);
        log.info("Risk score overridden for merchant={} by {}: overall={}, level={}",
                merchantId, performedBy, updated.getOverallScore(), updated.getAutomationLevel());
        return updated;
    }

    public BulkUpdateResult bulkUpdate(BulkRiskUpdate update, String performedBy) {
        validateBulk(update);
        List<String> merchantIds = update.getMerchantIds().stream().distinct().collect(Collectors.toList());
        BigDecimal factor = update.getAdjustmentFactor() != null ? BigDecimal.valueOf(update.getAdjustmentFactor()) : null;

        List<MerchantRiskScore> updated = new ArrayList<>();
        for (String merchantId : merchantIds) {
            MerchantRiskScore current = scoreRepo.findByMerchantId(merchantId)
                    .orElseGet(() -> refreshRiskScore(merchantId, performedBy));
            Map<String, Object> before = scoreDetails(current);

            MerchantRiskScore next = current.toBuilder().build();
            if (update.getAutomationLevel() != null) {
                applyLevel(next, update.getAutomationLevel());
                next.setLevelOverridden(true);
            }
            if (factor != null) {
                next.setDailyLimit(scale(next.getDailyLimit(), factor));
                next.setWeeklyLimit(scale(next.getWeeklyLimit(), factor));
                next.setMonthlyLimit(scale(next.getMonthlyLimit(), factor));
                next.setSingleTransactionLimit(scale(next.getSingleTransactionLimit(), factor));
                next.setRequiresApprovalAbove(scale(next.getRequiresApprovalAbove(), factor));
            }
            next.setLastUpdated(clock.millis());
            next.setUpdatedBy(performedBy);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("before", before);
            details.put("after", scoreDetails(next));
            details.put("reason", update.getReason());
            details.put("bulk", true);
            auditTrail.record(AuditEventType.RISK_SCORE_UPDATED, AuditEntry.ENTITY_MERCHANT, merchantId, performedBy, details);

            scoreRepo.save(next);
            updated.add(next);
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("merchantIds", merchantIds);
        summary.put("updated", updated.size());
        summary.put("reason", update.getReason());
        if (update.getAutomationLevel() != null) summary.put("automationLevel", update.getAutomationLevel().name());
        if (update.getAdjustmentFactor() != null) summary.put("adjustmentFactor", update.getAdjustmentFactor());
        auditTrail.record(AuditEventType.BULK_RISK_UPDATE, AuditEntry.ENTITY_SYSTEM, "risk-scores", performedBy, summary);

        log.info("Bulk risk update by {}: {} merchants, level={}, factor={}",
                performedBy, updated.size(), update.getAutomationLevel(), update.getAdjustmentFactor());
        return new BulkUpdateResult(update.getMerchantIds().size(), updated.size(), updated);
    }

    /**
     * Scores ordered by merchant id. The cursor is the last merchant id of the previous page.
     */
    public PagedResponse<RiskScoreView> findScores(AutomationLevel level, Double minScore, Double maxScore,
                                                   int limit, String cursor) {
        List<MerchantRiskScore> matches = scoreRepo.findAll().stream()
                .filter(s -> level == null || s.getAutomationLevel() == level)
                .filter(s -> minScore == null || s.getOverallScore() >= minScore)
                .filter(s -> maxScore == null || s.getOverallScore() <= maxScore)
                .filter(s -> cursor == null || cursor.isEmpty() || s.getMerchantId().compareTo(cursor) > 0)
                .sorted(Comparator.comparing(MerchantRiskScore::getMerchantId))
                .collect(Collectors.toList());

        boolean hasMore = matches.size() > limit;
        List<MerchantRiskScore> page = hasMore ? matches.subList(0, limit) : matches;
        List<RiskScoreView> views = page.stream()
                .map(s -> new RiskScoreView(s, merchantStats(s.getMerchantId())))
                .collect(Collectors.toList());
        String nextCursor = hasMore ? page.get(page.size() - 1).getMerchantId() : null;
        return new PagedResponse<>(views, hasMore, nextCursor);
    }

    public Optional<RiskScoreView> findScoreView(String merchantId) {
        return scoreRepo.findByMerchantId(merchantId)
                .map(s -> new RiskScoreView(s, merchantStats(merchantId)));
    }

    public RiskScoreSummary summarize() {
        List<MerchantRiskScore> all = scoreRepo.findAll();
        return RiskScoreSummary.builder()
                .totalMerchants(all.size())
                .fullAutomation(all.stream().filter(s -> s.getAutomationLevel() == AutomationLevel.FULL).count())
                .partialAutomation(all.stream().filter(s -> s.getAutomationLevel() == AutomationLevel.PARTIAL).count())
                .manualReview(all.stream().filter(s -> s.getAutomationLevel() == AutomationLevel.MANUAL_REVIEW).count())
                .averageRiskScore(Math.round(all.stream().mapToDouble(MerchantRiskScore::getOverallScore)
                        .average().orElse(0.0) * 10.0) / 10.0)
                .highRiskMerchants(all.stream().filter(s -> s.getOverallScore() < HIGH_RISK_BELOW).count())
                .lowRiskMerchants(all.stream().filter(s -> s.getOverallScore() >= LOW_RISK_FROM).count())
                .build();
    }

    /**
     * Platform history plus payout totals. Null when the merchant platform is unreachable.
     */
    MerchantStats merchantStats(String merchantId) {
        Optional<MerchantSignals> signals;
        try {
            signals = signalProvider.fetchSignals(merchantId);
        } catch (RiskDataUnavailableException e) {
            log.debug("No merchant stats for {}: {}", merchantId, e.getMessage());
            return null;
        }

        List<PayoutRequest> executed = payoutRepo.scan(r ->
                merchantId.equals(r.getMerchantId()) && r.getStatus() == PayoutStatus.EXECUTED);
        BigDecimal paidOut = executed.stream().map(PayoutRequest::getAmount).reduce(BigDecimal.ZERO, BigDecimal::add);

        MerchantStats.MerchantStatsBuilder stats = MerchantStats.builder()
                .totalPayouts(executed.size())
                .totalPaidOut(paidOut)
                .totalRevenue(BigDecimal.ZERO);
        signals.ifPresent(s -> stats
                .accountAgeDays(RiskFactorCalculator.accountAgeDays(s.getAccountCreatedAt(), clock.millis()))
                .totalOrders(s.getTotalOrders())
                .totalRevenue(s.getTotalRevenue() != null ? s.getTotalRevenue() : BigDecimal.ZERO)
                .recentOrders(s.getRecentOrders()));
        return stats.build();
    }

    private AutomationLevel deriveLevel(double overallScore) {
        return AutomationLevel.fromScore(overallScore, config.getFullThreshold(), config.getPartialThreshold());
    }

    private void applyDerivedLevel(MerchantRiskScore score, MerchantRiskScore existing) {
        if (existing != null && existing.isLevelOverridden()) {
            keepPinnedLevel(score, existing);
        } else {
            applyLevel(score, deriveLevel(score.getOverallScore()));
        }
    }

    private void keepPinnedLevel(MerchantRiskScore score, MerchantRiskScore pinned) {
        score.setAutomationLevel(pinned.getAutomationLevel());
        score.setLevelOverridden(true);
        score.setDailyLimit(pinned.getDailyLimit());
        score.setWeeklyLimit(pinned.getWeeklyLimit());
        score.setMonthlyLimit(pinned.getMonthlyLimit());
        score.setSingleTransactionLimit(pinned.getSingleTransactionLimit());
        score.setRequiresApprovalAbove(pinned.getRequiresApprovalAbove());
    }

    private void applyLevel(MerchantRiskScore score, AutomationLevel level) {
        AutomationConfig.LevelLimits limits = config.limitsFor(level);
        score.setAutomationLevel(level);
        score.setDailyLimit(limits.getDaily());
        score.setWeeklyLimit(limits.getWeekly());
        score.setMonthlyLimit(limits.getMonthly());
        score.setSingleTransactionLimit(limits.getSingleTransaction());
        score.setRequiresApprovalAbove(limits.getRequiresApprovalAbove());
    }

    private static BigDecimal scale(BigDecimal limit, BigDecimal factor) {
        if (limit == null) return null;
        return limit.multiply(factor).setScale(2, RoundingMode.DOWN).min(MinorUnits.MAX_AMOUNT);
    }

    private void validateOverride(RiskScoreOverride override) {
        if (override == null) {
            throw new ValidationException("override body is required");
        }
        requirePositive("dailyLimit", override.getDailyLimit());
        requirePositive("weeklyLimit", override.getWeeklyLimit());
        requirePositive("monthlyLimit", override.getMonthlyLimit());
        requirePositive("singleTransactionLimit", override.getSingleTransactionLimit());
        requirePositive("requiresApprovalAbove", override.getRequiresApprovalAbove());
    }

    private void validateBulk(BulkRiskUpdate update) {
        if (update == null || update.getMerchantIds() == null || update.getMerchantIds().isEmpty()) {
            throw new ValidationException("merchantIds must contain at least one merchant");
        }
        if (update.getMerchantIds().size() > MAX_BULK_MERCHANTS) {
            throw new ValidationException("merchantIds must contain at most " + MAX_BULK_MERCHANTS + " merchants");
        }
        if (update.getReason() == null || update.getReason().isBlank()) {
            throw new ValidationException("reason is required for bulk updates");
        }
        if (update.getAutomationLevel() == null && update.getAdjustmentFactor() == null) {
            throw new ValidationException("either automationLevel or adjustmentFactor must be given");
        }
        Double factor = update.getAdjustmentFactor();
        if (factor != null && (factor < MIN_ADJUSTMENT_FACTOR || factor > MAX_ADJUSTMENT_FACTOR)) {
            throw new ValidationException("adjustmentFactor must be between " + MIN_ADJUSTMENT_FACTOR
                    + " and " + MAX_ADJUSTMENT_FACTOR);
        }
    }

    private static void requirePositive(String field, BigDecimal value) {
        if (value == null) return;
        if (value.signum() <= 0) {
            throw new ValidationException(field + " must be positive");
        }
        if (!MinorUnits.fits(value)) {
            throw new ValidationException(field + " must not exceed " + MinorUnits.MAX_AMOUNT.toPlainString()
                    + " with at most " + MinorUnits.SCALE + " decimal places");
        }
    }

    static Map<String, Object> scoreDetails(MerchantRiskScore score) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("overallScore", score.getOverallScore());
        details.put("transactionHistoryScore", score.getTransactionHistoryScore());
        details.put("chargebackRateScore", score.getChargebackRateScore());
        details.put("accountAgeScore", score.getAccountAgeScore());
        details.put("verificationLevelScore", score.getVerificationLevelScore());
        details.put("recentActivityScore", score.getRecentActivityScore());
        details.put("automationLevel", score.getAutomationLevel() != null ? score.getAutomationLevel().name() : null);
        details.put("dailyLimit", String.valueOf(score.getDailyLimit()));
        details.put("weeklyLimit", String.valueOf(score.getWeeklyLimit()));
        details.put("monthlyLimit", String.valueOf(score.getMonthlyLimit()));
        details.put("singleTransactionLimit", String.valueOf(score.getSingleTransactionLimit()));
        details.put("requiresApprovalAbove", String.valueOf(score.getRequiresApprovalAbove()));
        details.put("payoutsHalted", score.isPayoutsHalted());
        details.put("active", score.isActive());
        return details;
    }
}
