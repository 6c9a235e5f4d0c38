package com.bank.payout.repository;

import com.bank.payout.model.LeaseScope;

/**
 * Expiring per-merchant mutex. A lease held by a crashed owner lapses after its TTL.
 */
public interface MerchantLeaseRepository {

    boolean tryAcquire(LeaseScope scope, String merchantId, String owner, int ttlSeconds);

    void release(LeaseScope scope, String merchantId, String owner);
}
