package com.bank.payout.service;

import com.bank.payout.config.AutomationConfig;
import com.bank.payout.exception.EmergencyHaltException;
import com.bank.payout.exception.IdempotencyConflictException;
import com.bank.payout.exception.IllegalTransitionException;
import com.bank.payout.exception.NotFoundException;
import com.bank.payout.exception.ValidationException;
import com.bank.payout.model.*;
import com.bank.payout.repository.memory.InMemoryAuditTrailRepository;
import com.bank.payout.repository.memory.InMemoryLimitLedgerRepository;
import com.bank.payout.repository.memory.InMemoryMerchantLeaseRepository;
import com.bank.payout.repository.memory.InMemoryPayoutRequestRepository;
import com.bank.payout.testutil.TestDataFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.IntStream;

import static com.bank.payout.testutil.TestDataFactory.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PayoutOverrideServiceTest {

    @Mock
    private RiskScoringService riskScoringService;

    @Mock
    private EmergencyHaltService haltService;

    @Mock
    private PayoutWorker worker;

    private InMemoryPayoutRequestRepository repository;
    private InMemoryAuditTrailRepository auditRepo;
    private LimitLedgerService ledger;
    private PayoutOverrideService overrideService;

    @BeforeEach
    void setUp() {
        AutomationConfig config = TestDataFactory.automationConfig();
        repository = new InMemoryPayoutRequestRepository();
        auditRepo = new InMemoryAuditTrailRepository();
        ledger = new LimitLedgerService(new InMemoryLimitLedgerRepository());
        AuditTrailService auditTrail = new AuditTrailService(auditRepo, new ObjectMapper(), TestDataFactory.fixedClock());
        PayoutStateMachine stateMachine = new PayoutStateMachine(repository, auditTrail, TestDataFactory.fixedClock());
        MerchantLeaseService leaseService = new MerchantLeaseService(new InMemoryMerchantLeaseRepository(), config,
                TestDataFactory.fixedClock());
        overrideService = new PayoutOverrideService(repository, stateMachine, ledger, leaseService, riskScoringService,
                haltService, worker, TestDataFactory.fixedClock());
    }

    @Test
    void approve_reservesWithinLimits() {
        repository.create(TestDataFactory.createReviewRequest("P-1", "M-1", "6000"));
        when(riskScoringService.computeRiskScore("M-1"))
                .thenReturn(TestDataFactory.createRiskScore("M-1", AutomationLevel.FULL));

        PayoutRequest approved = overrideService.approve("P-1", "ops-alice", "verified with merchant");

        assertThat(approved.isApproved()).isTrue();
        assertThat(approved.getReviewedBy()).isEqualTo("ops-alice");
        assertThat(approved.getReservedAt()).isEqualTo(NOW);
        assertThat(ledger.consumption("M-1", LimitWindow.DAY, NOW).inFlight()).isEqualByComparingTo("6000");
        assertThat(auditRepo.scan(e -> e.getEventType() == AuditEventType.MANUAL_OVERRIDE_APPROVED))
                .singleElement()
                .satisfies(e -> assertThat(e.getDetails()).containsEntry("overLimit", false));
    }

    @Test
    void approve_amountOutsideLedgerRange_isRejectedAndStaysInReview() {
        repository.create(TestDataFactory.createReviewRequest("P-1", "M-1", "100000000000"));
        when(riskScoringService.computeRiskScore("M-1"))
                .thenReturn(TestDataFactory.createRiskScore("M-1", AutomationLevel.FULL));

        assertThatThrownBy(() -> overrideService.approve("P-1", "ops-alice", "one-off settlement"))
                .isInstanceOf(ValidationException.class);

        assertThat(repository.findById("P-1").get().isAwaitingReview()).isTrue();
        assertThat(ledger.consumption("M-1", LimitWindow.DAY, NOW).total()).isEqualByComparingTo("0");
        assertThat(auditRepo.scan(e -> e.getEventType() == AuditEventType.MANUAL_OVERRIDE_APPROVED)).isEmpty();
    }

    @Test
    void approve_beyondLimits_forceReservesAndFlagsOverLimit() {
        repository.create(TestDataFactory.createReviewRequest("P-1", "M-1", "12000"));
        when(riskScoringService.computeRiskScore("M-1"))
                .thenReturn(TestDataFactory.createRiskScore("M-1", AutomationLevel.FULL));

        overrideService.approve("P-1", "ops-alice", "one-off settlement");

        assertThat(ledger.consumption("M-1", LimitWindow.DAY, NOW).inFlight()).isEqualByComparingTo("12000");
        assertThat(auditRepo.scan(e -> e.getEventType() == AuditEventType.MANUAL_OVERRIDE_APPROVED))
                .singleElement()
                .satisfies(e -> assertThat(e.getDetails()).containsEntry("overLimit", true));
    }

    @Test
    void approve_requestNotInReview_isConflict() {
        repository.create(TestDataFactory.createPendingRequest("P-1", "M-1", "10"));

        assertThatThrownBy(() -> overrideService.approve("P-1", "ops-alice", null))
                .isInstanceOf(IllegalTransitionException.class);
        verifyNoInteractions(riskScoringService);
    }

    @Test
    void reject_movesReviewRequestToRejected() {
        repository.create(TestDataFactory.createReviewRequest("P-1", "M-1", "6000"));

        PayoutRequest rejected = overrideService.reject("P-1", "ops-bob", "suspicious destination");

        assertThat(rejected.getStatus()).isEqualTo(PayoutStatus.REJECTED);
        assertThat(rejected.getReviewedBy()).isEqualTo("ops-bob");
        assertThat(rejected.getFailureReason()).isEqualTo("suspicious destination");
    }

    @Test
    void reviewBatch_approvesEachRequestAndReportsFailuresPerId() {
        repository.create(TestDataFactory.createReviewRequest("P-1", "M-1", "1000"));
        repository.create(TestDataFactory.createReviewRequest("P-2", "M-1", "2000"));
        repository.create(TestDataFactory.createPendingRequest("P-3", "M-1", "10"));
        when(riskScoringService.computeRiskScore("M-1"))
                .thenReturn(TestDataFactory.createRiskScore("M-1", AutomationLevel.FULL));

        BatchReviewResult result = overrideService.reviewBatch(BatchReviewRequest.builder()
                .action(BatchReviewAction.APPROVE)
                .payoutIds(List.of("P-1", "P-2", "P-3", "missing", "P-1"))
                .reason("month-end settlement")
                .build(), "ops-alice");

        assertThat(result.requested()).isEqualTo(4);
        assertThat(result.succeeded()).isEqualTo(2);
        assertThat(result.failed()).isEqualTo(2);
        assertThat(result.results())
                .extracting(BatchReviewResult.Item::payoutId, BatchReviewResult.Item::success)
                .containsExactly(
                        tuple("P-1", true), tuple("P-2", true), tuple("P-3", false), tuple("missing", false));
        assertThat(result.results().get(3).error()).isEqualTo("Payout request not found: missing");
        assertThat(repository.findById("P-2").get().isApproved()).isTrue();
        assertThat(ledger.consumption("M-1", LimitWindow.DAY, NOW).inFlight()).isEqualByComparingTo("3000");
        assertThat(auditRepo.scan(e -> e.getEventType() == AuditEventType.MANUAL_OVERRIDE_APPROVED)).hasSize(2);
    }

    @Test
    void reviewBatch_rejectsWithReason() {
        repository.create(TestDataFactory.createReviewRequest("P-1", "M-1", "1000"));
        repository.create(TestDataFactory.createReviewRequest("P-2", "M-2", "1000"));

        BatchReviewResult result = overrideService.reviewBatch(BatchReviewRequest.builder()
                .action(BatchReviewAction.REJECT)
                .payoutIds(List.of("P-1", "P-2"))
                .reason("wallets flagged by compliance")
                .build(), "ops-bob");

        assertThat(result.succeeded()).isEqualTo(2);
        assertThat(result.results()).allSatisfy(item -> assertThat(item.status()).isEqualTo(PayoutStatus.REJECTED));
        assertThat(repository.findById("P-2").get().getFailureReason()).isEqualTo("wallets flagged by compliance");
        verifyNoInteractions(riskScoringService);
    }

    @Test
    void reviewBatch_validatesRequest() {
        assertThatThrownBy(() -> overrideService.reviewBatch(BatchReviewRequest.builder()
                .action(BatchReviewAction.APPROVE).payoutIds(List.of()).build(), "ops"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("payoutIds must contain at least one payout request");

        List<String> tooMany = IntStream.range(0, 51).mapToObj(i -> "P-" + i).toList();
        assertThatThrownBy(() -> overrideService.reviewBatch(BatchReviewRequest.builder()
                .action(BatchReviewAction.APPROVE).payoutIds(tooMany).build(), "ops"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("payoutIds must contain at most 50 payout requests");

        assertThatThrownBy(() -> overrideService.reviewBatch(BatchReviewRequest.builder()
                .payoutIds(List.of("P-1")).build(), "ops"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("action must be APPROVE or REJECT");

        assertThatThrownBy(() -> overrideService.reviewBatch(BatchReviewRequest.builder()
                .action(BatchReviewAction.REJECT).payoutIds(List.of("P-1")).build(), "ops"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("reason is required when rejecting");

        assertThat(auditRepo.scan(e -> true)).isEmpty();
    }

    @Test
    void cancel_releasesReservation() {
        repository.create(TestDataFactory.createPendingRequest("P-1", "M-1", "1000").toBuilder().reservedAt(NOW).build());
        ledger.forceReserve("M-1", new BigDecimal("1000"), NOW);

        PayoutRequest cancelled = overrideService.cancel("P-1", "ops-bob", "merchant request");

        assertThat(cancelled.getStatus()).isEqualTo(PayoutStatus.CANCELLED);
        assertThat(ledger.consumption("M-1", LimitWindow.DAY, NOW).total()).isEqualByComparingTo("0");
    }

    @Test
    void cancel_processingRequest_isConflict() {
        repository.create(TestDataFactory.createProcessingRequest("P-1", "M-1", "10"));

        assertThatThrownBy(() -> overrideService.cancel("P-1", "ops-bob", null))
                .isInstanceOf(IllegalTransitionException.class);
    }

    @Test
    void cancel_terminalRequest_isConflict() {
        repository.create(TestDataFactory.createPendingRequest("P-1", "M-1", "10").toBuilder()
                .status(PayoutStatus.EXECUTED).build());

        assertThatThrownBy(() -> overrideService.cancel("P-1", "ops-bob", null))
                .isInstanceOf(IllegalTransitionException.class);
    }

    @Test
    void unknownRequest_isNotFound() {
        assertThatThrownBy(() -> overrideService.reject("missing", "ops-bob", null))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Payout request not found: missing");
    }

    @Test
    void processNow_expeditesScheduledRequestAndDrainsMerchant() {
        repository.create(TestDataFactory.createPendingRequest("P-1", "M-1", "10").toBuilder()
                .scheduledFor(NOW + 86_400_000L).build());
        when(worker.drainMerchant("M-1")).thenReturn(1);

        PayoutRequest result = overrideService.processNow("P-1", "ops-alice");

        assertThat(result.isEligibleAt(NOW)).isTrue();
        verify(worker).drainMerchant("M-1");
        assertThat(auditRepo.scan(e -> e.getEventType() == AuditEventType.PROCESS_REQUESTED)).hasSize(1);
    }

    @Test
    void processNow_terminalRequest_returnsOriginalOutcome() {
        repository.create(TestDataFactory.createPendingRequest("P-1", "M-1", "10").toBuilder()
                .status(PayoutStatus.FAILED).failureReason("bad address").build());

        assertThatThrownBy(() -> overrideService.processNow("P-1", "ops-alice"))
                .isInstanceOf(IdempotencyConflictException.class);
        verifyNoInteractions(worker);
    }

    @Test
    void processNow_whileHalted_isRefused() {
        repository.create(TestDataFactory.createPendingRequest("P-1", "M-1", "10"));
        when(haltService.isHalted()).thenReturn(true);

        assertThatThrownBy(() -> overrideService.processNow("P-1", "ops-alice"))
                .isInstanceOf(EmergencyHaltException.class);
        verify(worker, never()).drainMerchant(anyString());
    }

    @Test
    void processNow_requestAwaitingReview_isConflict() {
        repository.create(TestDataFactory.createReviewRequest("P-1", "M-1", "10"));

        assertThatThrownBy(() -> overrideService.processNow("P-1", "ops-alice"))
                .isInstanceOf(IllegalTransitionException.class)
                .hasMessage("Payout P-1 is awaiting manual review");
    }
}
