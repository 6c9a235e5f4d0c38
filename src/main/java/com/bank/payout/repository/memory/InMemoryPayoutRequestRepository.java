package com.bank.payout.repository.memory;

import com.bank.payout.model.PayoutRequest;
import com.bank.payout.repository.PayoutRequestRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;

/**
 * Stores defensive copies so callers can only change a stored request through compareAndSet.
 */
@Repository
@ConditionalOnProperty(name = "payout.storage", havingValue = "memory")
public class InMemoryPayoutRequestRepository implements PayoutRequestRepository {

    private final Map<String, PayoutRequest> requests = new ConcurrentHashMap<>();
    private final Map<String, String> idempotencyKeys = new ConcurrentHashMap<>();

    @Override
    public void create(PayoutRequest request) {
        PayoutRequest stored = request.toBuilder().version(1).build();
        if (requests.putIfAbsent(request.getId(), stored) != null) {
            throw new IllegalStateException("Payout request already exists: " + request.getId());
        }
        request.setVersion(1);
    }

    @Override
    public Optional<PayoutRequest> findById(String id) {
        return Optional.ofNullable(requests.get(id)).map(r -> r.toBuilder().build());
    }

    @Override
    public List<PayoutRequest> scan(Predicate<PayoutRequest> filter) {
        return requests.values().stream()
                .filter(filter)
                .map(r -> r.toBuilder().build())
                .toList();
    }

    @Override
    public boolean compareAndSet(PayoutRequest request) {
        int expected = request.getVersion();
        AtomicBoolean swapped = new AtomicBoolean(false);
        requests.computeIfPresent(request.getId(), (id, current) -> {
            if (current.getVersion() != expected) {
                return current;
            }
            swapped.set(true);
            return request.toBuilder().version(expected + 1).build();
        });
        if (swapped.get()) {
            request.setVersion(expected + 1);
        }
        return swapped.get();
    }

    @Override
    public Optional<String> bindIdempotencyKey(String idempotencyKey, String requestId) {
        return Optional.ofNullable(idempotencyKeys.putIfAbsent(idempotencyKey, requestId));
    }
}
