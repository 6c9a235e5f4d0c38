package com.bank.payout.service;

import com.bank.payout.config.MetricsConfig;
import com.bank.payout.config.TwilioNotificationConfig;
import com.bank.payout.model.EmergencyHaltState;
import com.bank.payout.model.PayoutRequest;
import com.bank.payout.model.PayoutStatus;
import com.bank.payout.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.TraceContext;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OperatorAlertServiceTest {

    @Mock
    private Tracer tracer;

    @Mock
    private Span span;

    @Mock
    private TraceContext traceContext;

    private OperatorAlertService alertService;

    @BeforeEach
    void setUp() {
        alertService = new OperatorAlertService(new TwilioNotificationConfig(),
                new MetricsConfig(new SimpleMeterRegistry()), tracer);
    }

    @Test
    void failureAlert_carriesCurrentTraceId() {
        givenTrace("4bf92f3577b34da6a3ce929d0e0e4736");
        PayoutRequest failed = TestDataFactory.createPendingRequest("P-1", "M-1", "1000");
        failed.setStatus(PayoutStatus.FAILED);
        failed.setProcessingAttempts(3);
        failed.setFailureReason("wallet rejected");

        String body = alertService.failureBody(failed);

        assertThat(body).startsWith("[PAYOUT FAILED]")
                .contains("Payout ID: P-1")
                .contains("Attempts: 3/3")
                .contains("Reason: wallet rejected")
                .endsWith("\nTrace: 4bf92f3577b34da6a3ce929d0e0e4736");
    }

    @Test
    void haltAlert_carriesCurrentTraceId() {
        givenTrace("a3ce929d0e0e4736");
        EmergencyHaltState state = EmergencyHaltState.builder()
                .halted(true).changedBy("ops-alice").reason("treasury incident").build();

        assertThat(alertService.haltBody(state))
                .isEqualTo("[PAYOUT HALT] All payout processing stopped\nBy: ops-alice\nReason: treasury incident"
                        + "\nTrace: a3ce929d0e0e4736");
    }

    @Test
    void outsideAnyTrace_bodyHasNoTraceLine() {
        when(tracer.currentSpan()).thenReturn(null);
        EmergencyHaltState state = EmergencyHaltState.builder()
                .halted(true).changedBy("ops-alice").reason("treasury incident").build();

        assertThat(alertService.haltBody(state)).doesNotContain("Trace:");
    }

    @Test
    void disabledAlerts_sendNothing() {
        alertService.notifyPayoutFailed(TestDataFactory.createPendingRequest("P-1", "M-1", "1000"));

        verifyNoInteractions(tracer);
    }

    private void givenTrace(String traceId) {
        when(tracer.currentSpan()).thenReturn(span);
        when(span.context()).thenReturn(traceContext);
        when(traceContext.traceId()).thenReturn(traceId);
    }
}
