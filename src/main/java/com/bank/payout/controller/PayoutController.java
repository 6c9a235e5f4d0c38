package com.bank.payout.controller;

import com.bank.payout.model.AdmissionResult;
import com.bank.payout.model.AutomationMetrics;
import com.bank.payout.model.BatchReviewRequest;
import com.bank.payout.model.BatchReviewResult;
import com.bank.payout.model.DecisionOutcome;
import com.bank.payout.model.PagedResponse;
import com.bank.payout.model.PayoutCandidate;
import com.bank.payout.model.PayoutPriority;
import com.bank.payout.model.PayoutRequest;
import com.bank.payout.model.PayoutStatus;
import com.bank.payout.service.PayoutAdmissionService;
import com.bank.payout.service.PayoutOverrideService;
import com.bank.payout.service.PayoutQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/payouts")
@Tag(name = "Payouts", description = "Payout admission, queue inspection and operator overrides")
public class PayoutController {

    private final PayoutAdmissionService admissionService;
    private final PayoutOverrideService overrideService;
    private final PayoutQueryService queryService;

    public PayoutController(PayoutAdmissionService admissionService,
                            PayoutOverrideService overrideService,
                            PayoutQueryService queryService) {
        this.admissionService = admissionService;
        this.overrideService = overrideService;
        this.queryService = queryService;
    }

    @PostMapping
    @Operation(summary = "Submit a payout candidate",
               description = "Runs the automation decision and queues the request. Returns 201 for a new request, "
                       + "200 with the existing request when originalRequestId was already submitted.")
    public ResponseEntity<PayoutRequest> create(
            @RequestBody PayoutCandidate candidate,
            @RequestHeader(value = OperatorIdentity.HEADER, required = false) String operatorId) {
        String performedBy = OperatorIdentity.require(operatorId);
        AdmissionResult result = admissionService.admit(candidate, performedBy);
        HttpStatus status = result.duplicate() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(result.request());
    }

    @GetMapping
    @Operation(summary = "List payout requests",
               description = "Newest first, with status summary and queue status. Pass nextCursor as before for the next page.")
    public ResponseEntity<Map<String, Object>> list(
            @RequestParam(required = false) PayoutStatus status,
            @RequestParam(required = false) String merchantId,
            @RequestParam(required = false) DecisionOutcome decision,
            @RequestParam(required = false) PayoutPriority priority,
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(required = false) String before) {
        PagedResponse<PayoutRequest> page = queryService.find(status, merchantId, decision, priority,
                Math.max(1, Math.min(limit, 500)), before);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("data", page.data());
        response.put("hasMore", page.hasMore());
        response.put("nextCursor", page.nextCursor());
        response.put("summary", queryService.summary());
        response.put("queueStatus", queryService.queueStatus());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/metrics")
    @Operation(summary = "Automation metrics", description = "Success, failure, automation and error rates")
    public ResponseEntity<AutomationMetrics> metrics() {
        return ResponseEntity.ok(queryService.metrics());
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a payout request")
    public ResponseEntity<PayoutRequest> get(@PathVariable String id) {
        return ResponseEntity.ok(queryService.get(id));
    }

    @PostMapping("/{id}/approve")
    @Operation(summary = "Approve a request held for manual review",
               description = "Reserves the amount against the merchant's limits, beyond them if needed.")
    public ResponseEntity<PayoutRequest> approve(
            @PathVariable String id,
            @RequestBody(required = false) Map<String, String> body,
            @RequestHeader(value = OperatorIdentity.HEADER, required = false) String operatorId) {
        String performedBy = OperatorIdentity.require(operatorId);
        return ResponseEntity.ok(overrideService.approve(id, performedBy, reason(body)));
    }

    @PostMapping("/{id}/reject")
    @Operation(summary = "Reject a request held for manual review")
    public ResponseEntity<PayoutRequest> reject(
            @PathVariable String id,
            @RequestBody(required = false) Map<String, String> body,
            @RequestHeader(value = OperatorIdentity.HEADER, required = false) String operatorId) {
        String performedBy = OperatorIdentity.require(operatorId);
        return ResponseEntity.ok(overrideService.reject(id, performedBy, reason(body)));
    }

    @PostMapping("/batch")
    @Operation(summary = "Approve or reject several requests held for manual review",
               description = "Each request is reviewed on its own; the response reports success or the error per id.")
    public ResponseEntity<BatchReviewResult> reviewBatch(
            @RequestBody BatchReviewRequest batch,
            @RequestHeader(value = OperatorIdentity.HEADER, required = false) String operatorId) {
        String performedBy = OperatorIdentity.require(operatorId);
        return ResponseEntity.ok(overrideService.reviewBatch(batch, performedBy));
    }

    @PostMapping("/{id}/cancel")
    @Operation(summary = "Cancel a pending request",
               description = "Only before the treasury call of the current attempt; a PROCESSING request returns 409.")
    public ResponseEntity<PayoutRequest> cancel(
            @PathVariable String id,
            @RequestBody(required = false) Map<String, String> body,
            @RequestHeader(value = OperatorIdentity.HEADER, required = false) String operatorId) {
        String performedBy = OperatorIdentity.require(operatorId);
        return ResponseEntity.ok(overrideService.cancel(id, performedBy, reason(body)));
    }

    @PostMapping("/{id}/process")
    @Operation(summary = "Process an approved request now",
               description = "Drains the merchant synchronously. A terminal request returns 409 with the original.")
    public ResponseEntity<PayoutRequest> process(
            @PathVariable String id,
            @RequestHeader(value = OperatorIdentity.HEADER, required = false) String operatorId) {
        String performedBy = OperatorIdentity.require(operatorId);
        return ResponseEntity.ok(overrideService.processNow(id, performedBy));
    }

    private static String reason(Map<String, String> body) {
        return body != null ? body.get("reason") : null;
    }
}
