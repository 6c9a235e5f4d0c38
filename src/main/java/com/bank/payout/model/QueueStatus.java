package com.bank.payout.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueStatus {

    private long eligibleNow;
    private long waitingBackoff;
    private long scheduledFuture;
    private long processing;
    private long awaitingReview;
    private int activeMerchants;
    private boolean halted;
}
