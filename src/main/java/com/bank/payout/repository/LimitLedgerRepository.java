package com.bank.payout.repository;

import com.bank.payout.model.LimitWindow;

/**
 * Per-merchant, per-window consumption buckets. Amounts are integer minor units
 * so that increments are atomic store operations.
 */
public interface LimitLedgerRepository {

    /**
     * @return {inFlight, executed} for the bucket containing {@code at}; zeros if none
     */
    long[] find(String merchantId, LimitWindow window, long at);

    void add(String merchantId, LimitWindow window, long at, long inFlightDelta, long executedDelta);
}
