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
public class AutomationMetrics {

    private long totalProcessed;
    private long successful;
    private long failed;
    private double avgProcessingTimeMs;
    private BigDecimal totalVolume;

    // percentages, 0-100
    private double automationRate;
    private double errorRate;
}
