package com.bank.payout.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger haltActive;
    private final AtomicInteger activeDrains;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.haltActive = registry.gauge("payout.emergency_halt.active", new AtomicInteger(0));
        this.activeDrains = registry.gauge("payout.dispatch.active_merchants", new AtomicInteger(0));
    }

    public void recordDecision(String outcome, double riskScore) {
        Counter.builder("payout.decision.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();

        DistributionSummary.builder("payout.decision.risk_score")
                .tag("outcome", outcome)
                .register(registry)
                .record(riskScore);
    }

    public void recordExecution(String status, long processingTimeMs) {
        Counter.builder("payout.execution.count")
                .tag("status", status)
                .register(registry)
                .increment();

        DistributionSummary.builder("payout.execution.processing_time_ms")
                .tag("status", status)
                .register(registry)
                .record(processingTimeMs);
    }

    public void recordRetry(int attempt) {
        Counter.builder("payout.retry.count")
                .tag("attempt", String.valueOf(attempt))
                .register(registry)
                .increment();
    }

    public void recordTreasuryHold() {
        Counter.builder("payout.treasury_halt.hold.count")
                .register(registry)
                .increment();
    }

    public void recordRiskScoreFailClosed() {
        Counter.builder("risk_score.fail_closed.count")
                .register(registry)
                .increment();
    }

    public void recordRiskScoreComputed(String automationLevel) {
        Counter.builder("risk_score.computed.count")
                .tag("automation_level", automationLevel)
                .register(registry)
                .increment();
    }

    public void recordStuckRecovered(int count) {
        Counter.builder("payout.stuck.recovered.count")
                .register(registry)
                .increment(count);
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void updateHaltActive(boolean halted) {
        haltActive.set(halted ? 1 : 0);
    }

    public void updateActiveDrains(int count) {
        activeDrains.set(count);
    }
}
