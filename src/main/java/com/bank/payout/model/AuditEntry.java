package com.bank.payout.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Immutable audit trail entry")
public class AuditEntry {

    public static final String ENTITY_PAYOUT = "PAYOUT";
    public static final String ENTITY_MERCHANT = "MERCHANT";
    public static final String ENTITY_SYSTEM = "SYSTEM";

    private String id;
    private AuditEventType eventType;

    @Schema(description = "PAYOUT, MERCHANT or SYSTEM", example = "PAYOUT")
    private String entityType;
    private String entityId;

    @Schema(description = "Operator id, or SYSTEM for automated actions", example = "ops-alice")
    private String performedBy;
    private Map<String, Object> details;
    private long createdAt;
}
