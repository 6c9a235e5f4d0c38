package com.bank.payout.service;

import com.bank.payout.config.AutomationConfig;
import com.bank.payout.config.MetricsConfig;
import com.bank.payout.exception.ValidationException;
import com.bank.payout.model.AuditEntry;
import com.bank.payout.model.AuditEventType;
import com.bank.payout.model.EmergencyHaltState;
import com.bank.payout.model.PayoutRequest;
import com.bank.payout.model.PayoutStatus;
import com.bank.payout.model.SystemHealth;
import com.bank.payout.repository.PayoutRequestRepository;
import com.bank.payout.repository.SystemControlRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Global stop switch for payout processing. While halted no request is admitted and no
 * PENDING request is claimed. Requests already in PROCESSING finish their current attempt.
 */
@Service
public class EmergencyHaltService {

    private static final Logger log = LoggerFactory.getLogger(EmergencyHaltService.class);

    static final long RECENT_WINDOW_MS = 24L * 60 * 60 * 1000;
    static final int RECENT_EVENTS = 20;

    private final SystemControlRepository controlRepo;
    private final PayoutRequestRepository payoutRepo;
    private final AuditTrailService auditTrail;
    private final OperatorAlertService alertService;
    private final AutomationConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public EmergencyHaltService(SystemControlRepository controlRepo,
                                PayoutRequestRepository payoutRepo,
                                AuditTrailService auditTrail,
                                OperatorAlertService alertService,
                                AutomationConfig config,
                                MetricsConfig metricsConfig,
                                Clock clock) {
        this.controlRepo = controlRepo;
        this.payoutRepo = payoutRepo;
        this.auditTrail = auditTrail;
        this.alertService = alertService;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    public boolean isHalted() {
        return controlRepo.getHaltState().isHalted();
    }

    public EmergencyHaltState status() {
        return controlRepo.getHaltState();
    }

    public EmergencyHaltState halt(String reason, String performedBy) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("reason is required to halt processing");
        }
        EmergencyHaltState state = EmergencyHaltState.builder()
                .halted(true)
                .reason(reason)
                .changedBy(performedBy)
                .changedAt(clock.millis())
                .build();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", reason);
        details.put("wasHalted", isHalted());
        auditTrail.record(AuditEventType.EMERGENCY_HALT, AuditEntry.ENTITY_SYSTEM, "payout-processing", performedBy, details);

        controlRepo.saveHaltState(state);
        metricsConfig.updateHaltActive(true);
        alertService.notifyEmergencyHalt(state);
        log.warn("EMERGENCY HALT activated by {}: {}", performedBy, reason);
        return state;
    }

    public EmergencyHaltState resume(String reason, String performedBy) {
        EmergencyHaltState previous = controlRepo.getHaltState();
        EmergencyHaltState state = EmergencyHaltState.builder()
                .halted(false)
                .reason(reason)
                .changedBy(performedBy)
                .changedAt(clock.millis())
                .build();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", reason != null ? reason : "");
        details.put("haltedSince", previous.isHalted() ? previous.getChangedAt() : 0L);
        auditTrail.record(AuditEventType.PROCESSING_RESUMED, AuditEntry.ENTITY_SYSTEM, "payout-processing", performedBy, details);

        controlRepo.saveHaltState(state);
        metricsConfig.updateHaltActive(false);
        log.info("Payout processing resumed by {}", performedBy);
        return state;
    }

    /**
     * Health score starts at 100: -50 while halted, -5 per failure in the last 24h (max -25),
     * -10 per stuck request (max -30), -1 per 10 requests awaiting review (max -10).
     */
    public SystemHealth health() {
        long now = clock.millis();
        long stuckCutoff = now - config.getStuckProcessingTimeoutMinutes() * 60_000L;
        List<PayoutRequest> all = payoutRepo.scan(r -> true);

        long recentFailures = all.stream()
                .filter(r -> r.getStatus() == PayoutStatus.FAILED && r.getUpdatedAt() >= now - RECENT_WINDOW_MS)
                .count();
        long stuck = all.stream()
                .filter(r -> r.getStatus() == PayoutStatus.PROCESSING
                        && r.getProcessingStartedAt() != null && r.getProcessingStartedAt() < stuckCutoff)
                .count();
        long reviewQueue = all.stream().filter(PayoutRequest::isAwaitingReview).count();
        boolean halted = isHalted();

        int score = 100;
        if (halted) score -= 50;
        score -= (int) Math.min(25, recentFailures * 5);
        score -= (int) Math.min(30, stuck * 10);
        score -= (int) Math.min(10, reviewQueue / 10);

        return SystemHealth.builder()
                .halted(halted)
                .recentFailures(recentFailures)
                .stuckRequests(stuck)
                .manualReviewQueue(reviewQueue)
                .healthScore(Math.max(0, score))
                .recentEvents(auditTrail.recent(RECENT_EVENTS))
                .build();
    }
}
