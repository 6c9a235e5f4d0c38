package com.bank.payout.controller;

import com.bank.payout.model.EmergencyHaltState;
import com.bank.payout.model.SystemHealth;
import com.bank.payout.service.EmergencyHaltService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/control")
@Tag(name = "Control", description = "Emergency halt and system health")
public class ControlController {

    private final EmergencyHaltService haltService;

    public ControlController(EmergencyHaltService haltService) {
        this.haltService = haltService;
    }

    @GetMapping("/status")
    @Operation(summary = "Current emergency halt state")
    public ResponseEntity<EmergencyHaltState> status() {
        return ResponseEntity.ok(haltService.status());
    }

    @GetMapping("/health")
    @Operation(summary = "Payout system health",
               description = "Recent failures, stuck requests, review backlog and a 0-100 health score")
    public ResponseEntity<SystemHealth> health() {
        return ResponseEntity.ok(haltService.health());
    }

    @PostMapping("/halt")
    @Operation(summary = "Halt all payout processing",
               description = "Stops admission and dispatch. Requests already executing finish their current attempt.")
    public ResponseEntity<EmergencyHaltState> halt(
            @RequestBody Map<String, String> body,
            @RequestHeader(value = OperatorIdentity.HEADER, required = false) String operatorId) {
        String performedBy = OperatorIdentity.require(operatorId);
        return ResponseEntity.ok(haltService.halt(body.get("reason"), performedBy));
    }

    @PostMapping("/resume")
    @Operation(summary = "Resume payout processing")
    public ResponseEntity<EmergencyHaltState> resume(
            @RequestBody(required = false) Map<String, String> body,
            @RequestHeader(value = OperatorIdentity.HEADER, required = false) String operatorId) {
        String performedBy = OperatorIdentity.require(operatorId);
        return ResponseEntity.ok(haltService.resume(body != null ? body.get("reason") : null, performedBy));
    }
}
