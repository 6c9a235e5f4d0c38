package com.bank.payout.model;

import io.swagger.v3.oas.annotations.media.Schema;
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
@Schema(description = "A withdrawal/disbursement candidate submitted for automated decisioning")
public class PayoutCandidate {

    @Schema(description = "Merchant identifier", example = "MERCH-001")
    private String merchantId;

    @Schema(description = "Positive payout amount, up to 8 decimals", example = "1000.00")
    private BigDecimal amount;

    @Schema(description = "Settlement currency; defaults to TAIC", example = "TAIC")
    private String currency;

    @Schema(description = "Destination wallet address", example = "0x9f2c4e1b7a3d5c6e8f0a1b2c3d4e5f6a7b8c9d0e")
    private String destinationWallet;

    @Schema(description = "Destination network", example = "FANTOM")
    private String destinationNetwork;

    private ScheduleType scheduleType;

    @Schema(description = "Earliest execution time in epoch millis; defaults to now")
    private Long scheduledFor;

    @Schema(description = "Defaults from schedule type when absent")
    private PayoutPriority priority;

    @Schema(description = "Upstream identifier; resubmissions with the same value are deduplicated")
    private String originalRequestId;

    private Map<String, String> metadata;
}
