package com.bank.payout.service;

import com.bank.payout.config.AutomationConfig;
import com.bank.payout.config.MetricsConfig;
import com.bank.payout.model.PayoutRequest;
import com.bank.payout.model.PayoutStatus;
import com.bank.payout.repository.PayoutRequestRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Returns requests abandoned in PROCESSING (worker crash, lost response) to the queue.
 * Re-submission is safe because the treasury deduplicates by idempotency key.
 */
@Service
public class StuckPayoutRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(StuckPayoutRecoveryService.class);

    private final PayoutRequestRepository repository;
    private final PayoutStateMachine stateMachine;
    private final AutomationConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public StuckPayoutRecoveryService(PayoutRequestRepository repository,
                                      PayoutStateMachine stateMachine,
                                      AutomationConfig config,
                                      MetricsConfig metricsConfig,
                                      Clock clock) {
        this.repository = repository;
        this.stateMachine = stateMachine;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${payout.automation.stuck-check-interval-ms:60000}",
               initialDelayString = "${payout.automation.stuck-check-interval-ms:60000}")
    public int recoverStuckRequests() {
        long cutoff = clock.millis() - config.getStuckProcessingTimeoutMinutes() * 60_000L;
        List<PayoutRequest> stuck = repository.findByStatus(PayoutStatus.PROCESSING).stream()
                .filter(r -> r.getProcessingStartedAt() != null && r.getProcessingStartedAt() < cutoff)
                .toList();

        int recovered = 0;
        for (PayoutRequest request : stuck) {
            try {
                if (stateMachine.recoverStuck(request).isPresent()) {
                    recovered++;
                    log.warn("Recovered stuck payout={} claimed by {} at {}",
                            request.getId(), request.getClaimedBy(), request.getProcessingStartedAt());
                }
            } catch (RuntimeException e) {
                log.error("Failed to recover stuck payout={}: {}", request.getId(), e.getMessage(), e);
            }
        }

        if (recovered > 0) {
            metricsConfig.recordStuckRecovered(recovered);
        }
        return recovered;
    }
}
