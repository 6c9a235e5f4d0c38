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
public class BatchReviewRequest {

    private BatchReviewAction action;

    @Schema(description = "1 to 50 payout request ids held for manual review")
    private List<String> payoutIds;

    @Schema(description = "Recorded on every request; required when rejecting", example = "verified with merchant")
    private String reason;
}
