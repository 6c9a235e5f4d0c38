package com.bank.payout.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MerchantStats {

    private long accountAgeDays;
    private long totalOrders;
    private BigDecimal totalRevenue;
    private long recentOrders;
    private long totalPayouts;
    private BigDecimal totalPaidOut;
}
