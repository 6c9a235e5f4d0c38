package com.bank.payout.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmergencyHaltState {

    private boolean halted;
    private String reason;
    private String changedBy;
    private long changedAt;

    public static EmergencyHaltState running() {
        return EmergencyHaltState.builder().halted(false).build();
    }
}
