package com.bank.payout.model;

import java.util.List;

public record BulkUpdateResult(int requested, int updated, List<MerchantRiskScore> scores) {}
