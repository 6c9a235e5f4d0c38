package com.bank.payout.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Risk score plus derived merchant statistics. merchantStats is null when
 * the merchant platform could not be reached.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskScoreView {

    private MerchantRiskScore riskScore;
    private MerchantStats merchantStats;
}
