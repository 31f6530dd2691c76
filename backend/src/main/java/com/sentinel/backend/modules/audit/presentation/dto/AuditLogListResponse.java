package com.sentinel.backend.modules.audit.presentation.dto;

import java.util.List;

public record AuditLogListResponse(boolean success, List<AuditEntryResponse> logs) {
}
