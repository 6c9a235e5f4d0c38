package com.bank.payout.controller;

import com.bank.payout.model.AutomationLevel;
import com.bank.payout.model.BulkRiskUpdate;
import com.bank.payout.model.BulkUpdateResult;
import com.bank.payout.model.MerchantRiskScore;
import com.bank.payout.model.PagedResponse;
import com.bank.payout.model.RecalculationReport;
import com.bank.payout.model.RiskScoreOverride;
import com.bank.payout.model.RiskScoreView;
import com.bank.payout.service.RiskScoringService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/risk-scores")
@Tag(name = "Risk Scores", description = "Merchant risk scores, automation levels and payout limits")
public class RiskScoreController {

    private final RiskScoringService riskScoringService;

    public RiskScoreController(RiskScoringService riskScoringService) {
        this.riskScoringService = riskScoringService;
    }

    @GetMapping
    @Operation(summary = "List merchant risk scores",
               description = "Paginated by merchant id, with summary statistics across all merchants.")
    public ResponseEntity<Map<String, Object>> listScores(
            @RequestParam(required = false) AutomationLevel automationLevel,
            @RequestParam(required = false) Double minScore,
            @RequestParam(required = false) Double maxScore,
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(required = false) String before) {
        PagedResponse<RiskScoreView> page = riskScoringService.findScores(
                automationLevel, minScore, maxScore, Math.max(1, Math.min(limit, 500)), before);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("data", page.data());
        response.put("hasMore", page.hasMore());
        response.put("nextCursor", page.nextCursor());
        response.put("summary", riskScoringService.summarize());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{merchantId}")
    @Operation(summary = "Get a merchant's risk score with merchant statistics")
    public ResponseEntity<?> getScore(@PathVariable String merchantId) {
        return riskScoringService.findScoreView(merchantId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(404)
                        .body(Map.of("error", "No risk score for merchant " + merchantId)));
    }

    @PutMapping("/{merchantId}")
    @Operation(summary = "Override a merchant's risk score",
               description = "Null fields are left unchanged. Setting automationLevel pins it against recalculation.")
    public ResponseEntity<MerchantRiskScore> overrideScore(
            @PathVariable String merchantId,
            @RequestBody RiskScoreOverride override,
            @RequestHeader(value = OperatorIdentity.HEADER, required = false) String operatorId) {
        String performedBy = OperatorIdentity.require(operatorId);
        return ResponseEntity.ok(riskScoringService.overrideScore(merchantId, override, performedBy));
    }

    @PostMapping("/bulk-update")
    @Operation(summary = "Bulk update automation level or limits",
               description = "1-100 merchants; adjustmentFactor (0.1-2.0) multiplies every limit. reason is mandatory.")
    public ResponseEntity<BulkUpdateResult> bulkUpdate(
            @RequestBody BulkRiskUpdate update,
            @RequestHeader(value = OperatorIdentity.HEADER, required = false) String operatorId) {
        String performedBy = OperatorIdentity.require(operatorId);
        return ResponseEntity.ok(riskScoringService.bulkUpdate(update, performedBy));
    }

    @PostMapping("/{merchantId}/recalculate")
    @Operation(summary = "Recalculate one merchant's score from current signals")
    public ResponseEntity<MerchantRiskScore> recalculate(
            @PathVariable String merchantId,
            @RequestHeader(value = OperatorIdentity.HEADER, required = false) String operatorId) {
        String performedBy = OperatorIdentity.require(operatorId);
        return ResponseEntity.ok(riskScoringService.refreshRiskScore(merchantId, performedBy));
    }

    @PostMapping("/recalculate")
    @Operation(summary = "Recalculate every active merchant",
               description = "Runs synchronously. One merchant failing does not stop the sweep.")
    public ResponseEntity<RecalculationReport> recalculateAll(
            @RequestHeader(value = OperatorIdentity.HEADER, required = false) String operatorId) {
        String performedBy = OperatorIdentity.require(operatorId);
        return ResponseEntity.ok(riskScoringService.recalculateAll(performedBy));
    }
}
