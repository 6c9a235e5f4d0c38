package com.bank.payout.repository;

import com.bank.payout.model.PayoutRequest;
import com.bank.payout.model.PayoutStatus;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Payout request store with optimistic concurrency. Every mutation after creation goes
 * through {@link #compareAndSet}, keyed on the version read by the caller.
 */
public interface PayoutRequestRepository {

    /**
     * Insert a new request. Fails if the id already exists.
     */
    void create(PayoutRequest request);

    Optional<PayoutRequest> findById(String id);

    List<PayoutRequest> scan(Predicate<PayoutRequest> filter);

    /**
     * Replace the stored request only if its version still equals {@code request.getVersion()}.
     * On success the request's version is advanced to the stored one.
     *
     * @return false if another writer got there first
     */
    boolean compareAndSet(PayoutRequest request);

    /**
     * Bind an idempotency key to a request id, once.
     *
     * @return the id already bound to the key, or empty if this call bound it
     */
    Optional<String> bindIdempotencyKey(String idempotencyKey, String requestId);

    default List<PayoutRequest> findByStatus(PayoutStatus status) {
        return scan(r -> r.getStatus() == status);
    }

    /**
     * Approved PENDING requests whose schedule and retry backoff have elapsed at {@code now}.
     * Called on every dispatch poll, so implementations must not read terminal requests.
     */
    default List<PayoutRequest> findEligible(long now) {
        return findByStatus(PayoutStatus.PENDING).stream()
                .filter(r -> r.isEligibleAt(now))
                .toList();
    }

    default List<PayoutRequest> findEligible(String merchantId, long now) {
        return findByStatus(PayoutStatus.PENDING).stream()
                .filter(r -> merchantId.equals(r.getMerchantId()) && r.isEligibleAt(now))
                .toList();
    }

    default List<PayoutRequest> findByMerchantId(String merchantId) {
        return scan(r -> merchantId.equals(r.getMerchantId()));
    }
}
