package com.bank.payout.service;

import com.bank.payout.config.AutomationConfig;
import com.bank.payout.config.MetricsConfig;
import com.bank.payout.engine.AutomationDecisionEngine;
import com.bank.payout.exception.EmergencyHaltException;
import com.bank.payout.exception.ValidationException;
import com.bank.payout.model.AdmissionResult;
import com.bank.payout.model.AuditEntry;
import com.bank.payout.model.AuditEventType;
import com.bank.payout.model.AutomationDecision;
import com.bank.payout.model.DecisionOutcome;
import com.bank.payout.model.DestinationNetwork;
import com.bank.payout.model.LeaseScope;
import com.bank.payout.model.LedgerSnapshot;
import com.bank.payout.model.MerchantRiskScore;
import com.bank.payout.model.PayoutCandidate;
import com.bank.payout.model.PayoutPriority;
import com.bank.payout.model.PayoutRequest;
import com.bank.payout.model.PayoutStatus;
import com.bank.payout.model.ReservationResult;
import com.bank.payout.model.ScheduleType;
import com.bank.payout.repository.PayoutRequestRepository;
import com.bank.payout.support.MinorUnits;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for payout candidates: validation, deduplication, automated decision,
 * limit reservation and persistence.
 *
 * Flow:
 * 1. Validate and normalize the candidate
 * 2. Refuse while the emergency halt is active
 * 3. Bind the idempotency key; a bound key returns the existing request
 * 4. Under the merchant's LEDGER lease: snapshot ledger, decide, reserve on AUTO_APPROVE
 * 5. Journal the decision and the creation, then persist
 * 6. Kick off dispatch for REAL_TIME approvals
 */
@Service
public class PayoutAdmissionService {

    private static final Logger log = LoggerFactory.getLogger(PayoutAdmissionService.class);

    static final String IDEMPOTENCY_PREFIX = "orig:";

    private final PayoutRequestRepository repository;
    private final RiskScoringService riskScoringService;
    private final AutomationDecisionEngine decisionEngine;
    private final LimitLedgerService ledgerService;
    private final MerchantLeaseService leaseService;
    private final EmergencyHaltService haltService;
    private final AuditTrailService auditTrail;
    private final PayoutDispatcher dispatcher;
    private final AutomationConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public PayoutAdmissionService(PayoutRequestRepository repository,
                                  RiskScoringService riskScoringService,
                                  AutomationDecisionEngine decisionEngine,
                                  LimitLedgerService ledgerService,
                                  MerchantLeaseService leaseService,
                                  EmergencyHaltService haltService,
                                  AuditTrailService auditTrail,
                                  PayoutDispatcher dispatcher,
                                  AutomationConfig config,
                                  MetricsConfig metricsConfig,
                                  Clock clock) {
        this.repository = repository;
        this.riskScoringService = riskScoringService;
        this.decisionEngine = decisionEngine;
        this.ledgerService = ledgerService;
        this.leaseService = leaseService;
        this.haltService = haltService;
        this.auditTrail = auditTrail;
        this.dispatcher = dispatcher;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @Observed(name = "payout.admit", contextualName = "admit-payout")
    public AdmissionResult admit(PayoutCandidate submitted, String performedBy) {
        PayoutCandidate candidate = normalize(submitted);
        if (haltService.isHalted()) {
            throw new EmergencyHaltException("Payout processing is halted, candidate not admitted");
        }

        String requestId = UUID.randomUUID().toString();
        String idempotencyKey = candidate.getOriginalRequestId() != null
                ? IDEMPOTENCY_PREFIX + candidate.getOriginalRequestId()
                : UUID.randomUUID().toString();

        Optional<String> boundId = repository.bindIdempotencyKey(idempotencyKey, requestId);
        if (boundId.isPresent()) {
            Optional<PayoutRequest> existing = repository.findById(boundId.get());
            if (existing.isPresent()) {
                return duplicate(existing.get(), candidate, performedBy);
            }
            // key bound by an admission that never persisted its request
            requestId = boundId.get();
        }

        MerchantRiskScore score = riskScoringService.computeRiskScore(candidate.getMerchantId());
        String id = requestId;
        PayoutRequest request;
        try {
            request = leaseService.withLease(LeaseScope.LEDGER, candidate.getMerchantId(),
                    () -> decideAndPersist(id, idempotencyKey, candidate, score, performedBy));
        } catch (IllegalStateException e) {
            // a concurrent submission with the same key persisted first
            PayoutRequest existing = repository.findById(id).orElseThrow(() -> e);
            return duplicate(existing, candidate, performedBy);
        }

        metricsConfig.recordDecision(request.getAutomationDecision().name(), score.getOverallScore());
        log.info("Payout admitted: id={}, merchant={}, amount={} {}, decision={}, reasons={}",
                request.getId(), request.getMerchantId(), request.getAmount().toPlainString(),
                request.getCurrency(), request.getAutomationDecision(), request.getDecisionReasons());

        switch (request.getAutomationDecision()) {
            case AUTO_APPROVE -> {
                if (request.getScheduleType() == ScheduleType.REAL_TIME) {
                    dispatcher.dispatchMerchant(request.getMerchantId());
                }
            }
            case MANUAL_REVIEW, AUTO_REJECT -> {
                // nothing to dispatch
            }
        }
        return new AdmissionResult(request, false);
    }

    private PayoutRequest decideAndPersist(String requestId, String idempotencyKey, PayoutCandidate candidate,
                                           MerchantRiskScore score, String performedBy) {
        if (repository.findById(requestId).isPresent()) {
            throw new IllegalStateException("Payout request already exists: " + requestId);
        }
        long now = clock.millis();
        LedgerSnapshot ledger = ledgerService.snapshot(candidate.getMerchantId(), now);
        AutomationDecision decision = decisionEngine.decide(candidate, score, ledger);

        Long reservedAt = null;
        switch (decision.outcome()) {
            case AUTO_APPROVE -> {
                ReservationResult reservation = ledgerService.reserve(candidate.getMerchantId(), candidate.getAmount(), score, now);
                if (reservation.reserved()) {
                    reservedAt = now;
                } else {
                    decision = AutomationDecision.review("exceeds " + reservation.exceededWindow().getLabel() + " limit");
                }
            }
            case MANUAL_REVIEW, AUTO_REJECT -> {
                // no reservation until an operator approves
            }
        }

        PayoutRequest request = buildRequest(requestId, idempotencyKey, candidate, score, decision, reservedAt, now);
        try {
            repository.create(request);
        } catch (RuntimeException e) {
            if (reservedAt != null) {
                ledgerService.release(candidate.getMerchantId(), candidate.getAmount(), reservedAt);
            }
            throw e;
        }
        // only the admission that created the request records its decision
        auditTrail.record(AuditEventType.AUTOMATION_DECISION, AuditEntry.ENTITY_PAYOUT, requestId,
                RiskScoringService.SYSTEM, decisionDetails(request, score, ledger));
        auditTrail.record(AuditEventType.PAYOUT_CREATED, AuditEntry.ENTITY_PAYOUT, requestId,
                performedBy, creationDetails(request));
        return request;
    }

    private PayoutRequest buildRequest(String requestId, String idempotencyKey, PayoutCandidate candidate,
                                       MerchantRiskScore score, AutomationDecision decision, Long reservedAt, long now) {
        PayoutStatus status = switch (decision.outcome()) {
            case AUTO_REJECT -> PayoutStatus.REJECTED;
            case AUTO_APPROVE, MANUAL_REVIEW -> PayoutStatus.PENDING;
        };
        boolean approved = decision.outcome() == DecisionOutcome.AUTO_APPROVE;
        boolean rejected = status == PayoutStatus.REJECTED;

        return PayoutRequest.builder()
                .id(requestId)
                .merchantId(candidate.getMerchantId())
                .amount(candidate.getAmount())
                .currency(candidate.getCurrency())
                .destinationWallet(candidate.getDestinationWallet())
                .destinationNetwork(DestinationNetwork.valueOf(candidate.getDestinationNetwork()))
                .scheduleType(candidate.getScheduleType())
                .scheduledFor(candidate.getScheduledFor())
                .priority(candidate.getPriority())
                .status(status)
                .riskScoreAtDecision(score.getOverallScore())
                .automationLevelAtDecision(score.getAutomationLevel())
                .automationDecision(decision.outcome())
                .decisionReasons(decision.reasons())
                .approved(approved)
                .processingAttempts(0)
                .maxAttempts(config.getMaxAttempts())
                .nextAttemptAt(0L)
                .failureReason(rejected ? String.join("; ", decision.reasons()) : null)
                .idempotencyKey(idempotencyKey)
                .originalRequestId(candidate.getOriginalRequestId())
                .reservedAt(reservedAt)
                .metadata(candidate.getMetadata())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private AdmissionResult duplicate(PayoutRequest existing, PayoutCandidate candidate, String performedBy) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("idempotencyKey", existing.getIdempotencyKey());
        details.put("originalRequestId", candidate.getOriginalRequestId());
        details.put("status", existing.getStatus().name());
        auditTrail.record(AuditEventType.IDEMPOTENCY_CONFLICT, AuditEntry.ENTITY_PAYOUT, existing.getId(), performedBy, details);
        log.info("Duplicate submission for originalRequestId={}, returning payout={}",
                candidate.getOriginalRequestId(), existing.getId());
        return new AdmissionResult(existing, true);
    }

    PayoutCandidate normalize(PayoutCandidate c) {
        if (c == null) {
            throw new ValidationException("payout candidate is required");
        }
        if (c.getMerchantId() == null || c.getMerchantId().isBlank()) {
            throw new ValidationException("merchantId is required");
        }
        BigDecimal amount = c.getAmount();
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException("amount must be positive");
        }
        if (amount.stripTrailingZeros().scale() > MinorUnits.SCALE) {
            throw new ValidationException("amount supports at most 8 decimal places");
        }
        if (amount.compareTo(MinorUnits.MAX_AMOUNT) > 0) {
            throw new ValidationException("amount must not exceed " + MinorUnits.MAX_AMOUNT.toPlainString());
        }
        String currency = c.getCurrency() == null || c.getCurrency().isBlank()
                ? config.getDefaultCurrency() : c.getCurrency().trim().toUpperCase();
        if (config.getSupportedCurrencies().stream().noneMatch(currency::equalsIgnoreCase)) {
            throw new ValidationException("unsupported currency: " + currency);
        }
        if (c.getDestinationWallet() == null || c.getDestinationWallet().isBlank()) {
            throw new ValidationException("destinationWallet is required");
        }
        if (c.getDestinationNetwork() == null || c.getDestinationNetwork().isBlank()) {
            throw new ValidationException("destinationNetwork is required");
        }
        DestinationNetwork network = DestinationNetwork.parse(c.getDestinationNetwork())
                .orElseThrow(() -> new ValidationException("unsupported destination network: " + c.getDestinationNetwork()));
        if (c.getScheduleType() == null) {
            throw new ValidationException("scheduleType is required");
        }
        String originalRequestId = c.getOriginalRequestId() == null || c.getOriginalRequestId().isBlank()
                ? null : c.getOriginalRequestId().trim();

        return PayoutCandidate.builder()
                .merchantId(c.getMerchantId().trim())
                .amount(amount)
                .currency(currency)
                .destinationWallet(c.getDestinationWallet().trim())
                .destinationNetwork(network.name())
                .scheduleType(c.getScheduleType())
                .scheduledFor(c.getScheduledFor() != null ? c.getScheduledFor() : clock.millis())
                .priority(c.getPriority() != null ? c.getPriority() : PayoutPriority.defaultFor(c.getScheduleType()))
                .originalRequestId(originalRequestId)
                .metadata(c.getMetadata() != null ? c.getMetadata() : Map.of())
                .build();
    }

    private static Map<String, Object> decisionDetails(PayoutRequest request, MerchantRiskScore score, LedgerSnapshot ledger) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("merchantId", request.getMerchantId());
        details.put("outcome", request.getAutomationDecision().name());
        details.put("reasons", List.copyOf(request.getDecisionReasons()));
        details.put("riskScore", score.getOverallScore());
        details.put("automationLevel", score.getAutomationLevel().name());
        details.put("amount", request.getAmount().toPlainString());
        ledger.consumed().forEach((window, consumed) -> details.put(window.getLabel() + "Consumed", consumed.toPlainString()));
        details.put("reserved", request.getReservedAt() != null);
        return details;
    }

    private static Map<String, Object> creationDetails(PayoutRequest request) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("merchantId", request.getMerchantId());
        details.put("amount", request.getAmount().toPlainString());
        details.put("currency", request.getCurrency());
        details.put("destinationNetwork", request.getDestinationNetwork().name());
        details.put("scheduleType", request.getScheduleType().name());
        details.put("priority", request.getPriority().name());
        details.put("status", request.getStatus().name());
        details.put("idempotencyKey", request.getIdempotencyKey());
        return details;
    }
}
