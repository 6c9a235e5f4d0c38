package com.bank.payout.service;

import com.bank.payout.exception.IllegalTransitionException;
import com.bank.payout.model.AuditEntry;
import com.bank.payout.model.AuditEventType;
import com.bank.payout.model.PayoutRequest;
import com.bank.payout.model.PayoutStatus;
import com.bank.payout.model.TreasuryTransferResult;
import com.bank.payout.repository.PayoutRequestRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Applies payout lifecycle transitions as compare-and-set writes on the request version.
 *
 * <p>Every transition except the claim is journaled before it is written; if the write then
 * loses the race a TRANSITION_ABORTED entry follows. The claim is written first and journaled
 * after, and is reverted when the journal write fails.</p>
 *
 * <p>Methods return empty when another writer changed the request first. The caller re-reads.</p>
 */
@Component
public class PayoutStateMachine {

    private static final Logger log = LoggerFactory.getLogger(PayoutStateMachine.class);

    private final PayoutRequestRepository repository;
    private final AuditTrailService auditTrail;
    private final Clock clock;

    public PayoutStateMachine(PayoutRequestRepository repository, AuditTrailService auditTrail, Clock clock) {
        this.repository = repository;
        this.auditTrail = auditTrail;
        this.clock = clock;
    }

    public Optional<PayoutRequest> claim(PayoutRequest pending, String workerId) {
        long now = clock.millis();
        requireTransition(pending, PayoutStatus.PROCESSING);
        if (!pending.isEligibleAt(now)) {
            return Optional.empty();
        }

        PayoutRequest claimed = pending.toBuilder()
                .status(PayoutStatus.PROCESSING)
                .processingStartedAt(now)
                .claimedBy(workerId)
                .updatedAt(now)
                .build();
        if (!repository.compareAndSet(claimed)) {
            log.debug("Lost claim race on payout={}", pending.getId());
            return Optional.empty();
        }

        try {
            Map<String, Object> details = transitionDetails(pending, claimed);
            details.put("workerId", workerId);
            details.put("attempt", pending.getProcessingAttempts() + 1);
            auditTrail.record(AuditEventType.PAYOUT_CLAIMED, AuditEntry.ENTITY_PAYOUT, claimed.getId(),
                    RiskScoringService.SYSTEM, details);
        } catch (RuntimeException e) {
            revertClaim(claimed, e);
            throw e;
        }
        return Optional.of(claimed);
    }

    private void revertClaim(PayoutRequest claimed, RuntimeException cause) {
        PayoutRequest reverted = claimed.toBuilder()
                .status(PayoutStatus.PENDING)
                .processingStartedAt(null)
                .claimedBy(null)
                .updatedAt(clock.millis())
                .build();
        if (repository.compareAndSet(reverted)) {
            log.error("Claim of payout={} reverted, audit write failed: {}", claimed.getId(), cause.getMessage());
        } else {
            log.error("Claim of payout={} could not be reverted after audit failure, stuck recovery will return it",
                    claimed.getId());
        }
    }

    public Optional<PayoutRequest> markExecuted(PayoutRequest attempted, TreasuryTransferResult result) {
        long now = clock.millis();
        PayoutRequest executed = attempted.toBuilder()
                .status(PayoutStatus.EXECUTED)
                .executedAt(now)
                .transactionHash(result.transactionHash())
                .treasuryTransactionId(result.treasuryTransactionId())
                .failureReason(null)
                .reservedAt(null)
                .updatedAt(now)
                .build();

        Map<String, Object> details = transitionDetails(attempted, executed);
        details.put("treasuryTransactionId", result.treasuryTransactionId());
        details.put("transactionHash", result.transactionHash());
        details.put("attempt", attempted.getProcessingAttempts());
        return transition(attempted, executed, AuditEventType.PAYOUT_EXECUTED, RiskScoringService.SYSTEM, details);
    }

    public Optional<PayoutRequest> scheduleRetry(PayoutRequest attempted, String reason, long nextAttemptAt) {
        PayoutRequest retry = attempted.toBuilder()
                .status(PayoutStatus.PENDING)
                .nextAttemptAt(nextAttemptAt)
                .failureReason(reason)
                .processingStartedAt(null)
                .claimedBy(null)
                .updatedAt(clock.millis())
                .build();

        Map<String, Object> details = transitionDetails(attempted, retry);
        details.put("attempt", attempted.getProcessingAttempts());
        details.put("nextAttemptAt", nextAttemptAt);
        details.put("reason", reason);
        return transition(attempted, retry, AuditEventType.PAYOUT_RETRY_SCHEDULED, RiskScoringService.SYSTEM, details);
    }

    public Optional<PayoutRequest> markFailed(PayoutRequest attempted, String reason) {
        PayoutRequest failed = attempted.toBuilder()
                .status(PayoutStatus.FAILED)
                .failureReason(reason)
                .reservedAt(null)
                .updatedAt(clock.millis())
                .build();

        Map<String, Object> details = transitionDetails(attempted, failed);
        details.put("attempt", attempted.getProcessingAttempts());
        details.put("reason", reason);
        return transition(attempted, failed, AuditEventType.PAYOUT_FAILED, RiskScoringService.SYSTEM, details);
    }

    /**
     * Returns a claimed request to the queue without spending an attempt. It is not eligible before {@code holdUntil}.
     */
    public Optional<PayoutRequest> holdForTreasuryHalt(PayoutRequest claimed, String reason, long holdUntil) {
        PayoutRequest held = claimed.toBuilder()
                .status(PayoutStatus.PENDING)
                .nextAttemptAt(holdUntil)
                .processingStartedAt(null)
                .claimedBy(null)
                .updatedAt(clock.millis())
                .build();

        Map<String, Object> details = transitionDetails(claimed, held);
        details.put("reason", reason);
        details.put("nextAttemptAt", holdUntil);
        return transition(claimed, held, AuditEventType.PAYOUT_HELD_TREASURY_HALT, RiskScoringService.SYSTEM, details);
    }

    public Optional<PayoutRequest> recoverStuck(PayoutRequest processing) {
        long now = clock.millis();
        PayoutRequest recovered = processing.toBuilder()
                .status(PayoutStatus.PENDING)
                .processingStartedAt(null)
                .claimedBy(null)
                .nextAttemptAt(now)
                .updatedAt(now)
                .build();

        Map<String, Object> details = transitionDetails(processing, recovered);
        details.put("claimedBy", processing.getClaimedBy());
        details.put("processingStartedAt", processing.getProcessingStartedAt());
        return transition(processing, recovered, AuditEventType.STUCK_REQUEST_RECOVERED, RiskScoringService.SYSTEM, details);
    }

    public Optional<PayoutRequest> approve(PayoutRequest pending, String performedBy, String reason,
                                           long reservedAt, boolean overLimit) {
        if (!pending.isAwaitingReview()) {
            throw new IllegalTransitionException("Payout " + pending.getId() + " is not awaiting manual review");
        }
        long now = clock.millis();
        PayoutRequest approved = pending.toBuilder()
                .approved(true)
                .reviewedBy(performedBy)
                .reviewedAt(now)
                .reservedAt(reservedAt)
                .updatedAt(now)
                .build();

        Map<String, Object> details = transitionDetails(pending, approved);
        details.put("reason", reason != null ? reason : "");
        details.put("overLimit", overLimit);
        return transition(pending, approved, AuditEventType.MANUAL_OVERRIDE_APPROVED, performedBy, details);
    }

    public Optional<PayoutRequest> reject(PayoutRequest pending, String performedBy, String reason) {
        long now = clock.millis();
        PayoutRequest rejected = pending.toBuilder()
                .status(PayoutStatus.REJECTED)
                .approved(false)
                .reviewedBy(performedBy)
                .reviewedAt(now)
                .failureReason(reason)
                .reservedAt(null)
                .updatedAt(now)
                .build();

        Map<String, Object> details = transitionDetails(pending, rejected);
        details.put("reason", reason != null ? reason : "");
        return transition(pending, rejected, AuditEventType.MANUAL_OVERRIDE_REJECTED, performedBy, details);
    }

    public Optional<PayoutRequest> cancel(PayoutRequest pending, String performedBy, String reason) {
        PayoutRequest cancelled = pending.toBuilder()
                .status(PayoutStatus.CANCELLED)
                .failureReason(reason)
                .reservedAt(null)
                .updatedAt(clock.millis())
                .build();

        Map<String, Object> details = transitionDetails(pending, cancelled);
        details.put("reason", reason != null ? reason : "");
        return transition(pending, cancelled, AuditEventType.PAYOUT_CANCELLED, performedBy, details);
    }

    /**
     * Clears the schedule and any retry backoff so the next drain picks the request up.
     */
    public Optional<PayoutRequest> expedite(PayoutRequest pending, String performedBy) {
        long now = clock.millis();
        PayoutRequest expedited = pending.toBuilder()
                .scheduledFor(Math.min(pending.getScheduledFor(), now))
                .nextAttemptAt(Math.min(pending.getNextAttemptAt(), now))
                .updatedAt(now)
                .build();

        Map<String, Object> details = transitionDetails(pending, expedited);
        details.put("scheduledFor", pending.getScheduledFor());
        details.put("nextAttemptAt", pending.getNextAttemptAt());
        return transition(pending, expedited, AuditEventType.PROCESS_REQUESTED, performedBy, details);
    }

    private Optional<PayoutRequest> transition(PayoutRequest current, PayoutRequest next, AuditEventType event,
                                               String performedBy, Map<String, Object> details) {
        requireTransition(current, next.getStatus());
        auditTrail.record(event, AuditEntry.ENTITY_PAYOUT, current.getId(), performedBy, details);

        if (repository.compareAndSet(next)) {
            return Optional.of(next);
        }

        Map<String, Object> aborted = new LinkedHashMap<>();
        aborted.put("abortedEvent", event.name());
        aborted.put("expectedVersion", current.getVersion());
        auditTrail.record(AuditEventType.TRANSITION_ABORTED, AuditEntry.ENTITY_PAYOUT, current.getId(), performedBy, aborted);
        log.warn("{} on payout={} aborted, request changed concurrently", event, current.getId());
        return Optional.empty();
    }

    private static void requireTransition(PayoutRequest current, PayoutStatus target) {
        if (!current.getStatus().canTransitionTo(target)) {
            throw new IllegalTransitionException("Payout " + current.getId() + " cannot move from "
                    + current.getStatus() + " to " + target);
        }
    }

    private static Map<String, Object> transitionDetails(PayoutRequest from, PayoutRequest to) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("merchantId", from.getMerchantId());
        details.put("fromStatus", from.getStatus().name());
        details.put("toStatus", to.getStatus().name());
        return details;
    }
}
