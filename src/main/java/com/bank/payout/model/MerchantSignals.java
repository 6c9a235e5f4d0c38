package com.bank.payout.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Raw merchant history as reported by the order/merchant platform.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MerchantSignals {

    private String merchantId;
    private long totalOrders;
    private BigDecimal totalRevenue;
    private long cancelledOrders;
    private long disputedOrders;
    // epoch millis; null when the platform does not report it
    private Long accountCreatedAt;
    private VerificationTier verificationTier;

    // trailing 30 days
    private long recentOrders;
    private BigDecimal recentRevenue;
}
