package com.bank.payout.controller;

import com.bank.payout.model.AuditEntry;
import com.bank.payout.model.AuditEventType;
import com.bank.payout.model.PagedResponse;
import com.bank.payout.service.AuditTrailService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

@RestController
@RequestMapping("/api/v1/audit")
@Tag(name = "Audit", description = "Append-only audit trail of decisions and mutations")
public class AuditController {

    static final MediaType NDJSON = MediaType.parseMediaType("application/x-ndjson");

    private final AuditTrailService auditTrailService;

    public AuditController(AuditTrailService auditTrailService) {
        this.auditTrailService = auditTrailService;
    }

    @GetMapping
    @Operation(summary = "Query audit entries", description = "Newest first, cursor-paginated.")
    public ResponseEntity<PagedResponse<AuditEntry>> query(
            @RequestParam(required = false) String entityType,
            @RequestParam(required = false) String entityId,
            @RequestParam(required = false) String performedBy,
            @RequestParam(required = false) AuditEventType eventType,
            @RequestParam(required = false) Long from,
            @RequestParam(required = false) Long to,
            @RequestParam(defaultValue = "100") int limit,
            @RequestParam(required = false) String before) {
        return ResponseEntity.ok(auditTrailService.query(entityType, entityId, performedBy, eventType,
                from, to, Math.max(1, Math.min(limit, 1000)), before));
    }

    @GetMapping("/export")
    @Operation(summary = "Export audit entries as NDJSON",
               description = "Oldest first, one JSON document per line, for compliance archiving.")
    public ResponseEntity<StreamingResponseBody> export(
            @RequestParam(required = false) Long from,
            @RequestParam(required = false) Long to) {
        StreamingResponseBody body = out -> {
            Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
            auditTrailService.export(from, to, writer);
        };
        return ResponseEntity.ok().contentType(NDJSON).body(body);
    }
}
