package com.bank.payout.service;

import com.bank.payout.config.AutomationConfig;
import com.bank.payout.model.LeaseScope;
import com.bank.payout.model.PayoutPriority;
import com.bank.payout.model.PayoutRequest;
import com.bank.payout.model.PayoutStatus;
import com.bank.payout.repository.PayoutRequestRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Comparator;
import java.util.Optional;
import java.util.UUID;

/**
 * Drains one merchant's eligible payouts, one at a time, while holding the merchant's DISPATCH lease.
 *
 * A drain stops at half the lease TTL so the lease never lapses under a live worker;
 * the next poll picks up whatever is left.
 */
@Component
public class PayoutWorker {

    private static final Logger log = LoggerFactory.getLogger(PayoutWorker.class);

    static final Comparator<PayoutRequest> DISPATCH_ORDER = Comparator
            .comparing((PayoutRequest r) -> r.getPriority() != null ? r.getPriority().getRank() : PayoutPriority.NORMAL.getRank())
            .reversed()
            .thenComparingLong(PayoutRequest::getCreatedAt)
            .thenComparing(PayoutRequest::getId);

    private final PayoutRequestRepository repository;
    private final PayoutStateMachine stateMachine;
    private final PayoutExecutionService executionService;
    private final MerchantLeaseService leaseService;
    private final EmergencyHaltService haltService;
    private final AutomationConfig config;
    private final Clock clock;
    private final String workerId = "worker-" + UUID.randomUUID().toString().substring(0, 8);

    public PayoutWorker(PayoutRequestRepository repository,
                        PayoutStateMachine stateMachine,
                        PayoutExecutionService executionService,
                        MerchantLeaseService leaseService,
                        EmergencyHaltService haltService,
                        AutomationConfig config,
                        Clock clock) {
        this.repository = repository;
        this.stateMachine = stateMachine;
        this.executionService = executionService;
        this.leaseService = leaseService;
        this.haltService = haltService;
        this.config = config;
        this.clock = clock;
    }

    /**
     * @return number of payouts attempted
     */
    public int drainMerchant(String merchantId) {
        Optional<String> lease = leaseService.tryAcquire(LeaseScope.DISPATCH, merchantId);
        if (lease.isEmpty()) {
            log.debug("Merchant={} is being drained elsewhere", merchantId);
            return 0;
        }

        long started = clock.millis();
        long budgetMs = config.getDispatch().getLeaseTtlSeconds() * 1000L / 2;
        String owner = workerId + "/" + Thread.currentThread().getName();
        int attempted = 0;
        try {
            while (clock.millis() - started < budgetMs) {
                if (haltService.isHalted()) {
                    log.info("Emergency halt active, stopping drain of merchant={}", merchantId);
                    break;
                }
                Optional<PayoutRequest> next = nextEligible(merchantId);
                if (next.isEmpty()) {
                    break;
                }
                Optional<PayoutRequest> claimed = stateMachine.claim(next.get(), owner);
                if (claimed.isEmpty()) {
                    continue;
                }
                PayoutRequest outcome;
                try {
                    outcome = executionService.process(claimed.get());
                } catch (RuntimeException e) {
                    log.error("Unexpected failure processing payout={}, left for stuck recovery: {}",
                            claimed.get().getId(), e.getMessage(), e);
                    break;
                }
                attempted++;
                if (isHeld(claimed.get(), outcome)) {
                    log.info("Payout={} held by treasury, stopping drain of merchant={}", outcome.getId(), merchantId);
                    break;
                }
            }
        } finally {
            leaseService.release(LeaseScope.DISPATCH, merchantId, lease.get());
        }

        if (attempted > 0) {
            log.info("Drained merchant={}: {} payouts attempted in {}ms", merchantId, attempted, clock.millis() - started);
        }
        return attempted;
    }

    // Returned to the queue without spending an attempt: the treasury refused to take it.
    private static boolean isHeld(PayoutRequest claimed, PayoutRequest outcome) {
        return outcome != null
                && outcome.getStatus() == PayoutStatus.PENDING
                && outcome.getProcessingAttempts() == claimed.getProcessingAttempts();
    }

    private Optional<PayoutRequest> nextEligible(String merchantId) {
        long now = clock.millis();
        return repository.findEligible(merchantId, now).stream().min(DISPATCH_ORDER);
    }
}
