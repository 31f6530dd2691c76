package com.sentinel.backend.modules.audit.presentation;

import java.util.List;

import com.sentinel.backend.global.error.ProblemException;
import com.sentinel.backend.modules.audit.application.AuditLogService;
import com.sentinel.backend.modules.audit.application.AuditLogService.AuditQuery;
import com.sentinel.backend.modules.audit.domain.AuditSeverity;
import com.sentinel.backend.modules.audit.presentation.dto.AuditEntryResponse;
import com.sentinel.backend.modules.audit.presentation.dto.AuditLogListResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/audit")
public class AuditLogController {

    private final AuditLogService auditLogService;

    public AuditLogController(AuditLogService auditLogService) {
        this.auditLogService = auditLogService;
    }

    @Operation(summary = "Query the audit log", description = "Newest first; limit defaults to 100 and is capped at 500.")
    @GetMapping("/logs")
    public ResponseEntity<AuditLogListResponse> list(
            @RequestParam(name = "accountId", required = false) Long accountId,
            @RequestParam(name = "action", required = false) String action,
            @RequestParam(name = "severity", required = false) String severity,
            @RequestParam(name = "limit", required = false) Integer limit
    ) {
        AuditQuery query = new AuditQuery(accountId, action, parseSeverity(severity));
        List<AuditEntryResponse> logs = auditLogService.query(query, limit).stream()
                .map(AuditEntryResponse::from)
                .toList();
        return ResponseEntity.ok(new AuditLogListResponse(true, logs));
    }

    private static AuditSeverity parseSeverity(String raw) {
        try {
            return AuditSeverity.from(raw);
        } catch (IllegalArgumentException ex) {
            throw ProblemException.badRequest("INVALID_SEVERITY", "Unknown severity: " + raw);
        }
    }
}
