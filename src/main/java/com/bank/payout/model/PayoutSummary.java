package com.bank.payout.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayoutSummary {

    private Map<PayoutStatus, Long> byStatus;
    private long manualReviewQueue;
    private long autoApproved;
    private long autoRejected;
    private double avgProcessingTimeMs;
    private BigDecimal dailyVolume;
}
