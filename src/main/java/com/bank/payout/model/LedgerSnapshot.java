package com.bank.payout.model;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Point-in-time consumption (in-flight plus executed) of each limit window for one merchant.
 */
public record LedgerSnapshot(String merchantId, long takenAt, Map<LimitWindow, BigDecimal> consumed) {

    public LedgerSnapshot {
        consumed = Map.copyOf(consumed);
    }

    public BigDecimal consumed(LimitWindow window) {
        return consumed.getOrDefault(window, BigDecimal.ZERO);
    }

    public static LedgerSnapshot empty(String merchantId, long takenAt) {
        return new LedgerSnapshot(merchantId, takenAt, Map.of());
    }
}
