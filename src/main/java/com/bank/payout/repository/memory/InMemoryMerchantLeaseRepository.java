package com.bank.payout.repository.memory;

import com.bank.payout.model.LeaseScope;
import com.bank.payout.repository.MerchantLeaseRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

@Repository
@ConditionalOnProperty(name = "payout.storage", havingValue = "memory")
public class InMemoryMerchantLeaseRepository implements MerchantLeaseRepository {

    private record Lease(String owner, long expiresAt) {}

    private final Map<String, Lease> leases = new ConcurrentHashMap<>();

    @Override
    public boolean tryAcquire(LeaseScope scope, String merchantId, String owner, int ttlSeconds) {
        long now = System.currentTimeMillis();
        AtomicBoolean acquired = new AtomicBoolean(false);
        leases.compute(scope + ":" + merchantId, (key, current) -> {
            if (current != null && current.expiresAt() > now) {
                return current;
            }
            acquired.set(true);
            return new Lease(owner, now + ttlSeconds * 1000L);
        });
        return acquired.get();
    }

    @Override
    public void release(LeaseScope scope, String merchantId, String owner) {
        leases.computeIfPresent(scope + ":" + merchantId,
                (key, current) -> current.owner().equals(owner) ? null : current);
    }
}
