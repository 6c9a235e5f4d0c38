package com.bank.payout.service;

import com.bank.payout.exception.EmergencyHaltException;
import com.bank.payout.exception.IdempotencyConflictException;
import com.bank.payout.exception.IllegalTransitionException;
import com.bank.payout.exception.NotFoundException;
import com.bank.payout.exception.PayoutException;
import com.bank.payout.exception.ValidationException;
import com.bank.payout.model.BatchReviewAction;
import com.bank.payout.model.BatchReviewRequest;
import com.bank.payout.model.BatchReviewResult;
import com.bank.payout.model.LeaseScope;
import com.bank.payout.model.MerchantRiskScore;
import com.bank.payout.model.PayoutRequest;
import com.bank.payout.model.PayoutStatus;
import com.bank.payout.model.ReservationResult;
import com.bank.payout.repository.PayoutRequestRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Operator actions on individual payout requests.
 */
@Service
public class PayoutOverrideService {

    private static final Logger log = LoggerFactory.getLogger(PayoutOverrideService.class);

    static final int MAX_BATCH_SIZE = 50;

    private final PayoutRequestRepository repository;
    private final PayoutStateMachine stateMachine;
    private final LimitLedgerService ledgerService;
    private final MerchantLeaseService leaseService;
    private final RiskScoringService riskScoringService;
    private final EmergencyHaltService haltService;
    private final PayoutWorker worker;
    private final Clock clock;

    public PayoutOverrideService(PayoutRequestRepository repository,
                                 PayoutStateMachine stateMachine,
                                 LimitLedgerService ledgerService,
                                 MerchantLeaseService leaseService,
                                 RiskScoringService riskScoringService,
                                 EmergencyHaltService haltService,
                                 PayoutWorker worker,
                                 Clock clock) {
        this.repository = repository;
        this.stateMachine = stateMachine;
        this.ledgerService = ledgerService;
        this.leaseService = leaseService;
        this.riskScoringService = riskScoringService;
        this.haltService = haltService;
        this.worker = worker;
        this.clock = clock;
    }

    /**
     * Clears a request held for manual review. The amount is reserved against the merchant's
     * limits, and beyond them if necessary; the audit entry records which.
     */
    public PayoutRequest approve(String requestId, String performedBy, String reason) {
        PayoutRequest request = load(requestId);
        if (!request.isAwaitingReview()) {
            throw new IllegalTransitionException("Payout " + requestId + " is not awaiting manual review (status "
                    + request.getStatus() + ")");
        }

        PayoutRequest approved = leaseService.withLease(LeaseScope.LEDGER, request.getMerchantId(), () -> {
            long now = clock.millis();
            MerchantRiskScore score = riskScoringService.computeRiskScore(request.getMerchantId());
            ReservationResult reservation = ledgerService.reserve(request.getMerchantId(), request.getAmount(), score, now);
            boolean overLimit = !reservation.reserved();
            if (overLimit) {
                ledgerService.forceReserve(request.getMerchantId(), request.getAmount(), now);
            }

            Optional<PayoutRequest> result;
            try {
                result = stateMachine.approve(request, performedBy, reason, now, overLimit);
            } catch (RuntimeException e) {
                ledgerService.release(request.getMerchantId(), request.getAmount(), now);
                throw e;
            }
            if (result.isEmpty()) {
                ledgerService.release(request.getMerchantId(), request.getAmount(), now);
                throw new IllegalTransitionException("Payout " + requestId + " changed concurrently, approval aborted");
            }
            return result.get();
        });

        log.info("Payout={} approved by {} (reason: {})", requestId, performedBy, reason);
        return approved;
    }

    public PayoutRequest reject(String requestId, String performedBy, String reason) {
        PayoutRequest request = load(requestId);
        if (!request.isAwaitingReview()) {
            throw new IllegalTransitionException("Payout " + requestId + " is not awaiting manual review (status "
                    + request.getStatus() + ")");
        }

        PayoutRequest rejected = stateMachine.reject(request, performedBy, reason)
                .orElseThrow(() -> new IllegalTransitionException("Payout " + requestId + " changed concurrently, rejection aborted"));
        releaseReservation(request);
        log.info("Payout={} rejected by {} (reason: {})", requestId, performedBy, reason);
        return rejected;
    }

    public PayoutRequest cancel(String requestId, String performedBy, String reason) {
        PayoutRequest request = load(requestId);
        if (request.getStatus() == PayoutStatus.PROCESSING) {
            throw new IllegalTransitionException("Payout " + requestId + " is being executed and can no longer be cancelled");
        }

        PayoutRequest cancelled = stateMachine.cancel(request, performedBy, reason)
                .orElseThrow(() -> new IllegalTransitionException("Payout " + requestId + " changed concurrently, cancellation aborted"));
        releaseReservation(request);
        log.info("Payout={} cancelled by {} (reason: {})", requestId, performedBy, reason);
        return cancelled;
    }

    /**
     * Drains the request's merchant right away, skipping any schedule or retry backoff.
     */
    public PayoutRequest processNow(String requestId, String performedBy) {
        PayoutRequest request = load(requestId);
        if (request.getStatus().isTerminal()) {
            throw new IdempotencyConflictException(request);
        }
        if (haltService.isHalted()) {
            throw new EmergencyHaltException("Payout processing is halted");
        }
        if (request.getStatus() == PayoutStatus.PROCESSING) {
            return request;
        }
        if (request.isAwaitingReview()) {
            throw new IllegalTransitionException("Payout " + requestId + " is awaiting manual review");
        }

        if (!request.isEligibleAt(clock.millis())) {
            stateMachine.expedite(request, performedBy);
        }
        int attempted = worker.drainMerchant(request.getMerchantId());
        log.info("Process-now of payout={} by {}: {} payouts attempted for merchant={}",
                requestId, performedBy, attempted, request.getMerchantId());
        return load(requestId);
    }

    /**
     * Approves or rejects each listed request on its own. A request that cannot be reviewed is
     * reported in the result and does not stop the rest of the batch.
     */
    public BatchReviewResult reviewBatch(BatchReviewRequest batch, String performedBy) {
        validateBatch(batch);
        List<String> payoutIds = batch.getPayoutIds().stream().distinct().toList();

        List<BatchReviewResult.Item> results = new ArrayList<>(payoutIds.size());
        int succeeded = 0;
        for (String payoutId : payoutIds) {
            try {
                PayoutRequest reviewed = switch (batch.getAction()) {
                    case APPROVE -> approve(payoutId, performedBy, batch.getReason());
                    case REJECT -> reject(payoutId, performedBy, batch.getReason());
                };
                results.add(BatchReviewResult.Item.succeeded(reviewed));
                succeeded++;
            } catch (PayoutException e) {
                log.warn("Batch {} of payout={} by {} failed: {}", batch.getAction(), payoutId, performedBy, e.getMessage());
                results.add(BatchReviewResult.Item.failed(payoutId, e.getMessage()));
            }
        }

        log.info("Batch {} by {}: {} of {} requests succeeded", batch.getAction(), performedBy, succeeded, payoutIds.size());
        return new BatchReviewResult(payoutIds.size(), succeeded, payoutIds.size() - succeeded, results);
    }

    private void validateBatch(BatchReviewRequest batch) {
        if (batch == null || batch.getPayoutIds() == null || batch.getPayoutIds().isEmpty()) {
            throw new ValidationException("payoutIds must contain at least one payout request");
        }
        if (batch.getPayoutIds().size() > MAX_BATCH_SIZE) {
            throw new ValidationException("payoutIds must contain at most " + MAX_BATCH_SIZE + " payout requests");
        }
        if (batch.getPayoutIds().stream().anyMatch(id -> id == null || id.isBlank())) {
            throw new ValidationException("payoutIds must not contain blank ids");
        }
        if (batch.getAction() == null) {
            throw new ValidationException("action must be APPROVE or REJECT");
        }
        if (batch.getAction() == BatchReviewAction.REJECT && (batch.getReason() == null || batch.getReason().isBlank())) {
            throw new ValidationException("reason is required when rejecting");
        }
    }

    private void releaseReservation(PayoutRequest request) {
        if (request.getReservedAt() != null) {
            ledgerService.release(request.getMerchantId(), request.getAmount(), request.getReservedAt());
        }
    }

    private PayoutRequest load(String requestId) {
        return repository.findById(requestId)
                .orElseThrow(() -> new NotFoundException("Payout request not found: " + requestId));
    }
}
