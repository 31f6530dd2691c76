package com.sentinel.backend.modules.audit.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;

import com.sentinel.backend.modules.audit.domain.AuditEntry;
import com.sentinel.backend.modules.audit.domain.AuditSeverity;

public record AuditEntryResponse(
        Long id,
        Long accountId,
        String action,
        String description,
        String ipAddress,
        String userAgent,
        AuditSeverity severity,
        Map<String, Object> payload,
        OffsetDateTime occurredAt
) {

    public static AuditEntryResponse from(AuditEntry entry) {
        return new AuditEntryResponse(
                entry.getId(),
                entry.getActor() != null ? entry.getActor().getId() : null,
                entry.getAction(),
                entry.getDescription(),
                entry.getIpAddress(),
                entry.getUserAgent(),
                entry.getSeverity(),
                entry.getPayload(),
                entry.getOccurredAt()
        );
    }
}
