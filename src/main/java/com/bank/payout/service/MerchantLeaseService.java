package com.bank.payout.service;

import com.bank.payout.config.AutomationConfig;
import com.bank.payout.exception.LeaseUnavailableException;
import com.bank.payout.model.LeaseScope;
import com.bank.payout.repository.MerchantLeaseRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Serializes work per merchant across threads and instances.
 * LEDGER leases guard check-then-reserve on the limit ledger; DISPATCH leases guard a worker drain.
 */
@Service
public class MerchantLeaseService {

    private static final Logger log = LoggerFactory.getLogger(MerchantLeaseService.class);

    private static final long SPIN_INTERVAL_MS = 20;

    private final MerchantLeaseRepository repository;
    private final AutomationConfig config;
    private final Clock clock;
    private final String instanceId = UUID.randomUUID().toString().substring(0, 8);

    public MerchantLeaseService(MerchantLeaseRepository repository, AutomationConfig config, Clock clock) {
        this.repository = repository;
        this.config = config;
        this.clock = clock;
    }

    /**
     * @return the owner token if the lease was acquired
     */
    public Optional<String> tryAcquire(LeaseScope scope, String merchantId) {
        String owner = instanceId + ":" + UUID.randomUUID();
        if (repository.tryAcquire(scope, merchantId, owner, config.getDispatch().getLeaseTtlSeconds())) {
            return Optional.of(owner);
        }
        return Optional.empty();
    }

    public void release(LeaseScope scope, String merchantId, String owner) {
        try {
            repository.release(scope, merchantId, owner);
        } catch (RuntimeException e) {
            // the lease lapses on its own after the TTL
            log.warn("Failed to release {} lease for merchant={}: {}", scope, merchantId, e.getMessage());
        }
    }

    /**
     * Runs {@code action} while holding the merchant's lease, waiting up to the configured
     * ledger wait for a competing holder to finish.
     *
     * @throws LeaseUnavailableException if the lease is not obtained in time
     */
    public <T> T withLease(LeaseScope scope, String merchantId, Supplier<T> action) {
        long deadline = clock.millis() + config.getDispatch().getLedgerLeaseWaitMs();
        Optional<String> owner = tryAcquire(scope, merchantId);
        while (owner.isEmpty()) {
            if (clock.millis() >= deadline) {
                throw new LeaseUnavailableException("Merchant " + merchantId + " is busy, " + scope + " lease not acquired");
            }
            try {
                Thread.sleep(SPIN_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LeaseUnavailableException("Interrupted while waiting for " + scope + " lease of merchant " + merchantId);
            }
            owner = tryAcquire(scope, merchantId);
        }

        try {
            return action.get();
        } finally {
            release(scope, merchantId, owner.get());
        }
    }
}
