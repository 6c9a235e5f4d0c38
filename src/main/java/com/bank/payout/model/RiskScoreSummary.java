package com.bank.payout.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskScoreSummary {

    private long totalMerchants;
    private long fullAutomation;
    private long partialAutomation;
    private long manualReview;
    private double averageRiskScore;
    private long highRiskMerchants;
    private long lowRiskMerchants;
}
