package com.bank.payout.model;

import java.math.BigDecimal;

public record LimitWindowConsumption(String merchantId, LimitWindow window, long windowStart,
                                     BigDecimal inFlight, BigDecimal executed) {

    public BigDecimal total() {
        return inFlight.add(executed);
    }
}
