package com.bank.payout.service;

import com.bank.payout.config.MetricsConfig;
import com.bank.payout.exception.IdempotencyConflictException;
import com.bank.payout.exception.IllegalTransitionException;
import com.bank.payout.exception.PermanentGatewayException;
import com.bank.payout.exception.TransientGatewayException;
import com.bank.payout.exception.TreasuryHaltedException;
import com.bank.payout.gateway.TreasuryGateway;
import com.bank.payout.model.PayoutRequest;
import com.bank.payout.model.PayoutStatus;
import com.bank.payout.model.TreasuryTransferRequest;
import com.bank.payout.model.TreasuryTransferResult;
import com.bank.payout.repository.PayoutRequestRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * Executes one attempt of a claimed payout against the treasury and records the outcome.
 */
@Service
public class PayoutExecutionService {

    private static final Logger log = LoggerFactory.getLogger(PayoutExecutionService.class);

    private final TreasuryGateway treasuryGateway;
    private final PayoutStateMachine stateMachine;
    private final PayoutRequestRepository repository;
    private final LimitLedgerService ledgerService;
    private final EmergencyHaltService haltService;
    private final RetryBackoffPolicy backoffPolicy;
    private final OperatorAlertService alertService;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public PayoutExecutionService(TreasuryGateway treasuryGateway,
                                  PayoutStateMachine stateMachine,
                                  PayoutRequestRepository repository,
                                  LimitLedgerService ledgerService,
                                  EmergencyHaltService haltService,
                                  RetryBackoffPolicy backoffPolicy,
                                  OperatorAlertService alertService,
                                  MetricsConfig metricsConfig,
                                  Clock clock) {
        this.treasuryGateway = treasuryGateway;
        this.stateMachine = stateMachine;
        this.repository = repository;
        this.ledgerService = ledgerService;
        this.haltService = haltService;
        this.backoffPolicy = backoffPolicy;
        this.alertService = alertService;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * @param claimed a request in PROCESSING, as returned by the claim
     * @return the request after this attempt
     * @throws IdempotencyConflictException if the request already reached a terminal state
     */
    @Observed(name = "payout.execute", contextualName = "execute-payout")
    public PayoutRequest process(PayoutRequest claimed) {
        if (claimed.getStatus().isTerminal()) {
            throw new IdempotencyConflictException(claimed);
        }
        if (claimed.getStatus() != PayoutStatus.PROCESSING) {
            throw new IllegalTransitionException("Payout " + claimed.getId() + " must be claimed before execution, is "
                    + claimed.getStatus());
        }

        if (haltService.isHalted()) {
            log.info("Emergency halt raised after claim, returning payout={} to the queue", claimed.getId());
            return settle(claimed, stateMachine.holdForTreasuryHalt(claimed, "emergency halt active",
                    claimed.getNextAttemptAt()));
        }

        long now = clock.millis();
        PayoutRequest attempted = claimed.toBuilder()
                .processingAttempts(claimed.getProcessingAttempts() + 1)
                .lastAttemptAt(now)
                .build();

        try {
            TreasuryTransferResult result = treasuryGateway.execute(TreasuryTransferRequest.from(attempted));
            return onExecuted(attempted, result);
        } catch (TreasuryHaltedException e) {
            metricsConfig.recordTreasuryHold();
            log.warn("Treasury halted, holding payout={} without spending attempt: {}", claimed.getId(), e.getMessage());
            long holdUntil = clock.millis() + backoffPolicy.treasuryHaltHoldMs();
            return settle(claimed, stateMachine.holdForTreasuryHalt(claimed, e.getMessage(), holdUntil));
        } catch (PermanentGatewayException e) {
            log.error("Permanent treasury failure for payout={}: {}", claimed.getId(), e.getMessage());
            return onFailed(attempted, e.getMessage());
        } catch (TransientGatewayException e) {
            return onTransientFailure(attempted, e);
        }
    }

    private PayoutRequest onExecuted(PayoutRequest attempted, TreasuryTransferResult result) {
        Optional<PayoutRequest> executed = stateMachine.markExecuted(attempted, result);
        if (executed.isEmpty()) {
            // a later attempt re-submits the same idempotency key and receives this result again
            return reload(attempted);
        }
        if (attempted.getReservedAt() != null) {
            ledgerService.commit(attempted.getMerchantId(), attempted.getAmount(), attempted.getReservedAt());
        }

        PayoutRequest done = executed.get();
        long processingMs = done.getExecutedAt() - done.getCreatedAt();
        metricsConfig.recordExecution(PayoutStatus.EXECUTED.name(), processingMs);
        log.info("Payout executed: id={}, merchant={}, amount={} {}, tx={}, attempt={}",
                done.getId(), done.getMerchantId(), done.getAmount().toPlainString(), done.getCurrency(),
                done.getTreasuryTransactionId(), done.getProcessingAttempts());
        return done;
    }

    private PayoutRequest onTransientFailure(PayoutRequest attempted, TransientGatewayException e) {
        int attempt = attempted.getProcessingAttempts();
        if (attempt >= attempted.getMaxAttempts()) {
            log.error("Payout={} failed after {} attempts: {}", attempted.getId(), attempt, e.getMessage());
            return onFailed(attempted, "retries exhausted after " + attempt + " attempts: " + e.getMessage());
        }

        long delay = backoffPolicy.delayMs(attempt);
        metricsConfig.recordRetry(attempt);
        log.warn("Transient treasury failure for payout={} (attempt {}/{}), retrying in {}ms: {}",
                attempted.getId(), attempt, attempted.getMaxAttempts(), delay, e.getMessage());
        return settle(attempted, stateMachine.scheduleRetry(attempted, e.getMessage(), clock.millis() + delay));
    }

    private PayoutRequest onFailed(PayoutRequest attempted, String reason) {
        Optional<PayoutRequest> failed = stateMachine.markFailed(attempted, reason);
        if (failed.isEmpty()) {
            return reload(attempted);
        }
        if (attempted.getReservedAt() != null) {
            ledgerService.release(attempted.getMerchantId(), attempted.getAmount(), attempted.getReservedAt());
        }

        PayoutRequest done = failed.get();
        metricsConfig.recordExecution(PayoutStatus.FAILED.name(), done.getUpdatedAt() - done.getCreatedAt());
        alertService.notifyPayoutFailed(done);
        return done;
    }

    private PayoutRequest settle(PayoutRequest before, Optional<PayoutRequest> after) {
        return after.orElseGet(() -> reload(before));
    }

    private PayoutRequest reload(PayoutRequest request) {
        return repository.findById(request.getId()).orElse(request);
    }
}
