package com.bank.payout.service;

import com.bank.payout.config.MetricsConfig;
import com.bank.payout.model.AuditEventType;
import com.bank.payout.model.PayoutRequest;
import com.bank.payout.model.PayoutStatus;
import com.bank.payout.repository.memory.InMemoryAuditTrailRepository;
import com.bank.payout.repository.memory.InMemoryPayoutRequestRepository;
import com.bank.payout.testutil.TestDataFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.bank.payout.testutil.TestDataFactory.NOW;
import static org.assertj.core.api.Assertions.assertThat;

class StuckPayoutRecoveryServiceTest {

    private InMemoryPayoutRequestRepository repository;
    private InMemoryAuditTrailRepository auditRepo;
    private StuckPayoutRecoveryService recoveryService;

    @BeforeEach
    void setUp() {
        repository = new InMemoryPayoutRequestRepository();
        auditRepo = new InMemoryAuditTrailRepository();
        AuditTrailService auditTrail = new AuditTrailService(auditRepo, new ObjectMapper(), TestDataFactory.fixedClock());
        PayoutStateMachine stateMachine = new PayoutStateMachine(repository, auditTrail, TestDataFactory.fixedClock());
        recoveryService = new StuckPayoutRecoveryService(repository, stateMachine, TestDataFactory.automationConfig(),
                new MetricsConfig(new SimpleMeterRegistry()), TestDataFactory.fixedClock());
    }

    @Test
    void requestsProcessingBeyondTimeout_returnToPendingWithAttemptsKept() {
        repository.create(TestDataFactory.createProcessingRequest("P-1", "M-1", "10").toBuilder()
                .processingStartedAt(NOW - 45 * 60_000L)
                .processingAttempts(2)
                .build());
        repository.create(TestDataFactory.createProcessingRequest("P-2", "M-1", "10").toBuilder()
                .processingStartedAt(NOW - 5 * 60_000L)
                .build());

        int recovered = recoveryService.recoverStuckRequests();

        assertThat(recovered).isEqualTo(1);
        PayoutRequest stuck = repository.findById("P-1").orElseThrow();
        assertThat(stuck.getStatus()).isEqualTo(PayoutStatus.PENDING);
        assertThat(stuck.getProcessingAttempts()).isEqualTo(2);
        assertThat(stuck.getClaimedBy()).isNull();
        assertThat(stuck.isEligibleAt(NOW)).isTrue();
        assertThat(repository.findById("P-2").orElseThrow().getStatus()).isEqualTo(PayoutStatus.PROCESSING);
        assertThat(auditRepo.scan(e -> e.getEventType() == AuditEventType.STUCK_REQUEST_RECOVERED)).hasSize(1);
    }

    @Test
    void nothingStuck_recoversNothing() {
        repository.create(TestDataFactory.createPendingRequest("P-1", "M-1", "10"));

        assertThat(recoveryService.recoverStuckRequests()).isZero();
    }
}
