package com.bank.payout.service;

import com.bank.payout.config.AutomationConfig;
import com.bank.payout.config.MetricsConfig;
import com.bank.payout.exception.IdempotencyConflictException;
import com.bank.payout.exception.IllegalTransitionException;
import com.bank.payout.exception.PermanentGatewayException;
import com.bank.payout.exception.TransientGatewayException;
import com.bank.payout.exception.TreasuryHaltedException;
import com.bank.payout.gateway.TreasuryGateway;
import com.bank.payout.model.AuditEventType;
import com.bank.payout.model.LimitWindow;
import com.bank.payout.model.LimitWindowConsumption;
import com.bank.payout.model.PayoutRequest;
import com.bank.payout.model.PayoutStatus;
import com.bank.payout.model.TreasuryTransferRequest;
import com.bank.payout.model.TreasuryTransferResult;
import com.bank.payout.repository.memory.InMemoryAuditTrailRepository;
import com.bank.payout.repository.memory.InMemoryLimitLedgerRepository;
import com.bank.payout.repository.memory.InMemoryPayoutRequestRepository;
import com.bank.payout.testutil.TestDataFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Random;

import static com.bank.payout.testutil.TestDataFactory.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PayoutExecutionServiceTest {

    private static final long RESERVED_AT = NOW - 60_000L;

    @Mock
    private TreasuryGateway treasuryGateway;

    @Mock
    private EmergencyHaltService haltService;

    @Mock
    private OperatorAlertService alertService;

    private InMemoryPayoutRequestRepository repository;
    private InMemoryAuditTrailRepository auditRepo;
    private LimitLedgerService ledger;
    private PayoutStateMachine stateMachine;
    private PayoutExecutionService executionService;

    @BeforeEach
    void setUp() {
        AutomationConfig config = TestDataFactory.automationConfig();
        repository = new InMemoryPayoutRequestRepository();
        auditRepo = new InMemoryAuditTrailRepository();
        AuditTrailService auditTrail = new AuditTrailService(auditRepo, new ObjectMapper(), TestDataFactory.fixedClock());
        ledger = new LimitLedgerService(new InMemoryLimitLedgerRepository());
        stateMachine = new PayoutStateMachine(repository, auditTrail, TestDataFactory.fixedClock());
        executionService = new PayoutExecutionService(treasuryGateway, stateMachine, repository, ledger, haltService,
                new RetryBackoffPolicy(config, new Random(1)), alertService,
                new MetricsConfig(new SimpleMeterRegistry()), TestDataFactory.fixedClock());
    }

    @Test
    void success_executesAndCommitsReservation() {
        PayoutRequest claimed = claimedWithPriorAttempts(0);
        when(treasuryGateway.execute(any())).thenReturn(new TreasuryTransferResult("TRX-1", "0xabc"));

        PayoutRequest result = executionService.process(claimed);

        assertThat(result.getStatus()).isEqualTo(PayoutStatus.EXECUTED);
        assertThat(result.getProcessingAttempts()).isEqualTo(1);
        assertThat(result.getTreasuryTransactionId()).isEqualTo("TRX-1");
        assertThat(result.getTransactionHash()).isEqualTo("0xabc");
        assertThat(result.getExecutedAt()).isEqualTo(NOW);

        LimitWindowConsumption day = ledger.consumption("M-1", LimitWindow.DAY, RESERVED_AT);
        assertThat(day.inFlight()).isEqualByComparingTo("0");
        assertThat(day.executed()).isEqualByComparingTo("1000");
    }

    @Test
    void submitsRequestIdempotencyKeyToTreasury() {
        PayoutRequest claimed = claimedWithPriorAttempts(0);
        when(treasuryGateway.execute(any())).thenReturn(new TreasuryTransferResult("TRX-1", "0xabc"));

        executionService.process(claimed);

        ArgumentCaptor<TreasuryTransferRequest> captor = ArgumentCaptor.forClass(TreasuryTransferRequest.class);
        verify(treasuryGateway).execute(captor.capture());
        assertThat(captor.getValue().idempotencyKey()).isEqualTo("orig:P-1");
        assertThat(captor.getValue().amount()).isEqualByComparingTo("1000");
    }

    @Test
    void transientFailure_onFirstAttempt_schedulesRetry() {
        PayoutRequest claimed = claimedWithPriorAttempts(0);
        when(treasuryGateway.execute(any())).thenThrow(new TransientGatewayException("treasury timeout"));

        PayoutRequest result = executionService.process(claimed);

        assertThat(result.getStatus()).isEqualTo(PayoutStatus.PENDING);
        assertThat(result.getProcessingAttempts()).isEqualTo(1);
        assertThat(result.getNextAttemptAt()).isBetween(NOW + 500, NOW + 1000);
        assertThat(result.getFailureReason()).isEqualTo("treasury timeout");
        assertThat(repository.findById("P-1").orElseThrow().getProcessingAttempts()).isEqualTo(1);
        assertThat(ledger.consumption("M-1", LimitWindow.DAY, RESERVED_AT).inFlight()).isEqualByComparingTo("1000");
        assertThat(auditRepo.scan(e -> e.getEventType() == AuditEventType.PAYOUT_RETRY_SCHEDULED)).hasSize(1);
        verifyNoInteractions(alertService);
    }

    @Test
    void transientFailure_onLastAttempt_failsAndReleasesReservation() {
        PayoutRequest claimed = claimedWithPriorAttempts(2);
        when(treasuryGateway.execute(any())).thenThrow(new TransientGatewayException("treasury timeout"));

        PayoutRequest result = executionService.process(claimed);

        assertThat(result.getStatus()).isEqualTo(PayoutStatus.FAILED);
        assertThat(result.getProcessingAttempts()).isEqualTo(3);
        assertThat(result.getFailureReason()).isEqualTo("retries exhausted after 3 attempts: treasury timeout");
        assertThat(result.getReservedAt()).isNull();
        assertThat(ledger.consumption("M-1", LimitWindow.DAY, RESERVED_AT).total()).isEqualByComparingTo("0");
        verify(alertService).notifyPayoutFailed(result);
    }

    @Test
    void permanentFailure_failsWithoutRetry() {
        PayoutRequest claimed = claimedWithPriorAttempts(0);
        when(treasuryGateway.execute(any())).thenThrow(new PermanentGatewayException("invalid destination address"));

        PayoutRequest result = executionService.process(claimed);

        assertThat(result.getStatus()).isEqualTo(PayoutStatus.FAILED);
        assertThat(result.getProcessingAttempts()).isEqualTo(1);
        assertThat(result.getFailureReason()).isEqualTo("invalid destination address");
        verify(treasuryGateway, times(1)).execute(any());
    }

    @Test
    void treasuryHalt_holdsRequestWithoutSpendingAttempt() {
        PayoutRequest claimed = claimedWithPriorAttempts(1);
        when(treasuryGateway.execute(any())).thenThrow(new TreasuryHaltedException("treasury emergency halt"));

        PayoutRequest result = executionService.process(claimed);

        assertThat(result.getStatus()).isEqualTo(PayoutStatus.PENDING);
        assertThat(result.getProcessingAttempts()).isEqualTo(1);
        assertThat(result.getClaimedBy()).isNull();
        assertThat(result.getNextAttemptAt()).isEqualTo(NOW + 30_000);
        assertThat(result.isEligibleAt(NOW)).isFalse();
        assertThat(ledger.consumption("M-1", LimitWindow.DAY, RESERVED_AT).inFlight()).isEqualByComparingTo("1000");
        assertThat(auditRepo.scan(e -> e.getEventType() == AuditEventType.PAYOUT_HELD_TREASURY_HALT)).hasSize(1);
    }

    @Test
    void engineHaltAfterClaim_returnsRequestWithoutCallingTreasury() {
        PayoutRequest claimed = claimedWithPriorAttempts(0);
        when(haltService.isHalted()).thenReturn(true);

        PayoutRequest result = executionService.process(claimed);

        assertThat(result.getStatus()).isEqualTo(PayoutStatus.PENDING);
        assertThat(result.getProcessingAttempts()).isZero();
        verifyNoInteractions(treasuryGateway);
    }

    @Test
    void terminalRequest_isRefusedWithOriginalOutcome() {
        PayoutRequest executed = TestDataFactory.createPendingRequest("P-9", "M-1", "10").toBuilder()
                .status(PayoutStatus.EXECUTED).treasuryTransactionId("TRX-9").build();

        assertThatThrownBy(() -> executionService.process(executed))
                .isInstanceOfSatisfying(IdempotencyConflictException.class,
                        e -> assertThat(e.getOriginal().getTreasuryTransactionId()).isEqualTo("TRX-9"));
        verifyNoInteractions(treasuryGateway);
    }

    @Test
    void unclaimedRequest_isRefused() {
        PayoutRequest pending = TestDataFactory.createPendingRequest("P-9", "M-1", "10");

        assertThatThrownBy(() -> executionService.process(pending))
                .isInstanceOf(IllegalTransitionException.class);
        verifyNoInteractions(treasuryGateway);
    }

    private PayoutRequest claimedWithPriorAttempts(int attempts) {
        PayoutRequest pending = TestDataFactory.createPendingRequest("P-1", "M-1", "1000").toBuilder()
                .processingAttempts(attempts)
                .reservedAt(RESERVED_AT)
                .build();
        repository.create(pending);
        ledger.forceReserve("M-1", new BigDecimal("1000"), RESERVED_AT);
        return stateMachine.claim(pending, "worker-test").orElseThrow();
    }
}
