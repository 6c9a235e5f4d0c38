package com.bank.payout.model;

import java.util.Map;

public record RecalculationReport(int processed, int failed, Map<String, String> failures) {}
