package com.bank.payout.service;

import com.bank.payout.config.AutomationConfig;
import com.bank.payout.config.MetricsConfig;
import com.bank.payout.model.PayoutRequest;
import com.bank.payout.repository.PayoutRequestRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Polls for merchants with eligible payouts and hands each to the worker pool.
 * A merchant is never submitted twice while its drain is still running on this instance.
 */
@Service
public class PayoutDispatcher {

    private static final Logger log = LoggerFactory.getLogger(PayoutDispatcher.class);

    private final PayoutRequestRepository repository;
    private final PayoutWorker worker;
    private final EmergencyHaltService haltService;
    private final TaskExecutor executor;
    private final AutomationConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private final Set<String> draining = ConcurrentHashMap.newKeySet();

    public PayoutDispatcher(PayoutRequestRepository repository,
                            PayoutWorker worker,
                            EmergencyHaltService haltService,
                            @Qualifier("payoutWorkerExecutor") TaskExecutor executor,
                            AutomationConfig config,
                            MetricsConfig metricsConfig,
                            Clock clock) {
        this.repository = repository;
        this.worker = worker;
        this.haltService = haltService;
        this.executor = executor;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${payout.automation.dispatch.poll-interval-ms:2000}",
               initialDelayString = "${payout.automation.dispatch.initial-delay-ms:5000}")
    public void poll() {
        if (!config.getDispatch().isEnabled()) {
            return;
        }
        if (haltService.isHalted()) {
            log.debug("Emergency halt active, skipping dispatch poll");
            return;
        }

        long now = clock.millis();
        repository.findEligible(now).stream()
                .map(PayoutRequest::getMerchantId)
                .distinct()
                .forEach(this::dispatchMerchant);
    }

    /**
     * @return false if the merchant is already draining here or the pool is saturated
     */
    public boolean dispatchMerchant(String merchantId) {
        if (!draining.add(merchantId)) {
            return false;
        }
        metricsConfig.updateActiveDrains(draining.size());
        try {
            executor.execute(() -> {
                try {
                    worker.drainMerchant(merchantId);
                } catch (RuntimeException e) {
                    log.error("Drain of merchant={} failed: {}", merchantId, e.getMessage(), e);
                } finally {
                    draining.remove(merchantId);
                    metricsConfig.updateActiveDrains(draining.size());
                }
            });
            return true;
        } catch (TaskRejectedException e) {
            draining.remove(merchantId);
            metricsConfig.updateActiveDrains(draining.size());
            log.warn("Worker pool saturated, merchant={} deferred to next poll", merchantId);
            return false;
        }
    }

    public int activeMerchantCount() {
        return draining.size();
    }
}
