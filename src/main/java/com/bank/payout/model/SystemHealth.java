package com.bank.payout.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemHealth {

    private boolean halted;
    private long recentFailures;
    private long stuckRequests;
    private long manualReviewQueue;
    private int healthScore;
    private List<AuditEntry> recentEvents;
}
