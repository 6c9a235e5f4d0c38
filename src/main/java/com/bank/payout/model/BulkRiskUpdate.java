package com.bank.payout.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkRiskUpdate {

    @Schema(description = "1 to 100 merchant ids")
    private List<String> merchantIds;

    private AutomationLevel automationLevel;

    @Schema(description = "Multiplier applied to every limit, 0.1 to 2.0", example = "0.5")
    private Double adjustmentFactor;

    @Schema(description = "Mandatory justification", example = "Q3 chargeback review")
    private String reason;
}
