package com.bank.payout.controller;

import com.bank.payout.config.AutomationConfig;
import com.bank.payout.model.AuditEntry;
import com.bank.payout.model.AuditEventType;
import com.bank.payout.service.AuditTrailService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View and modify runtime automation configuration")
public class ConfigController {

    private final AutomationConfig automationConfig;
    private final AuditTrailService auditTrailService;

    public ConfigController(AutomationConfig automationConfig, AuditTrailService auditTrailService) {
        this.automationConfig = automationConfig;
        this.auditTrailService = auditTrailService;
    }

    @Operation(summary = "Get automation thresholds")
    @GetMapping("/automation")
    public ResponseEntity<Map<String, Object>> getAutomation() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("fullThreshold", automationConfig.getFullThreshold());
        response.put("partialThreshold", automationConfig.getPartialThreshold());
        response.put("partialAutoApproveFraction", automationConfig.getPartialAutoApproveFraction());
        response.put("maxAttempts", automationConfig.getMaxAttempts());
        response.put("stuckProcessingTimeoutMinutes", automationConfig.getStuckProcessingTimeoutMinutes());
        response.put("baseLimits", automationConfig.getBaseLimits());
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Update automation thresholds",
            description = "Changes apply immediately to this instance, are journaled, and reset on restart. "
                    + "Stored scores keep their level until recalculated.")
    @PutMapping("/automation")
    public ResponseEntity<?> updateAutomation(
            @RequestBody Map<String, Object> body,
            @RequestHeader(value = OperatorIdentity.HEADER, required = false) String operatorId) {
        String performedBy = OperatorIdentity.require(operatorId);

        double full = toDouble(body, "fullThreshold", automationConfig.getFullThreshold());
        double partial = toDouble(body, "partialThreshold", automationConfig.getPartialThreshold());
        double fraction = toDouble(body, "partialAutoApproveFraction", automationConfig.getPartialAutoApproveFraction());
        int maxAttempts = toInt(body, "maxAttempts", automationConfig.getMaxAttempts());

        if (partial < 0) return badRequest("partialThreshold must be >= 0", "partialThreshold");
        if (full > 100) return badRequest("fullThreshold must be <= 100", "fullThreshold");
        if (partial >= full) return badRequest("partialThreshold must be less than fullThreshold", "partialThreshold");
        if (fraction <= 0 || fraction > 1) return badRequest("partialAutoApproveFraction must be in (0, 1]", "partialAutoApproveFraction");
        if (maxAttempts < 1) return badRequest("maxAttempts must be >= 1", "maxAttempts");

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("before", thresholds());
        automationConfig.setFullThreshold(full);
        automationConfig.setPartialThreshold(partial);
        automationConfig.setPartialAutoApproveFraction(fraction);
        automationConfig.setMaxAttempts(maxAttempts);
        details.put("after", thresholds());
        auditTrailService.record(AuditEventType.CONFIG_UPDATED, AuditEntry.ENTITY_SYSTEM, "automation-config",
                performedBy, details);

        return getAutomation();
    }

    private Map<String, Object> thresholds() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("fullThreshold", automationConfig.getFullThreshold());
        values.put("partialThreshold", automationConfig.getPartialThreshold());
        values.put("partialAutoApproveFraction", automationConfig.getPartialAutoApproveFraction());
        values.put("maxAttempts", automationConfig.getMaxAttempts());
        return values;
    }

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    private double toDouble(Map<String, Object> body, String key, double defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.doubleValue();
        try { return Double.parseDouble(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }

    private int toInt(Map<String, Object> body, String key, int defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.intValue();
        try { return Integer.parseInt(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }
}
