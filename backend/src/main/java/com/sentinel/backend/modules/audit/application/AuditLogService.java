package com.sentinel.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.sentinel.backend.modules.audit.domain.AuditEntry;
import com.sentinel.backend.modules.audit.domain.AuditSeverity;
import com.sentinel.backend.modules.audit.infrastructure.persistence.AuditEntryRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Entry point to the audit trail.
 * <p>
 * {@link #record(AuditLogCommand)} never throws: the entry is handed to {@link AuditLogWriter}, which
 * persists it after the caller's transaction completes. A failed audit write is logged and dropped,
 * the primary operation is unaffected.
 * </p>
 */
@Service
public class AuditLogService {

    private static final Logger log = LoggerFactory.getLogger(AuditLogService.class);

    public static final int DEFAULT_QUERY_LIMIT = 100;
    public static final int MAX_QUERY_LIMIT = 500;

    private final ApplicationEventPublisher eventPublisher;
    private final AuditEntryRepository auditEntryRepository;
    private final Clock clock;

    public AuditLogService(
            ApplicationEventPublisher eventPublisher,
            AuditEntryRepository auditEntryRepository,
            Clock clock
    ) {
        this.eventPublisher = eventPublisher;
        this.auditEntryRepository = auditEntryRepository;
        this.clock = clock;
    }

    public void record(AuditLogCommand command) {
        try {
            Objects.requireNonNull(command, "command is required");
            if (command.action() == null || command.action().isBlank()) {
                throw new IllegalArgumentException("action is required");
            }
            eventPublisher.publishEvent(new AuditLogEvent(command, OffsetDateTime.now(clock)));
        } catch (RuntimeException ex) {
            log.warn("Dropping audit entry action={}: {}", command != null ? command.action() : null, ex.getMessage());
        }
    }

    public void record(Long accountId, String action, String description, String ipAddress) {
        record(AuditLogCommand.info(accountId, action, description, ipAddress));
    }

    @Transactional(readOnly = true)
    public List<AuditEntry> query(AuditQuery filter, Integer limit) {
        AuditQuery effective = filter != null ? filter : AuditQuery.unfiltered();
        return auditEntryRepository.search(
                effective.accountId(),
                blankToNull(effective.action()),
                effective.severity(),
                PageRequest.of(0, clampLimit(limit))
        );
    }

    static int clampLimit(Integer limit) {
        if (limit == null || limit <= 0) {
            return DEFAULT_QUERY_LIMIT;
        }
        return Math.min(limit, MAX_QUERY_LIMIT);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public record AuditLogCommand(
            Long accountId,
            String action,
            String description,
            String ipAddress,
            String userAgent,
            AuditSeverity severity,
            Map<String, Object> payload
    ) {

        public AuditLogCommand {
            severity = severity != null ? severity : AuditSeverity.INFO;
        }

        public static AuditLogCommand info(Long accountId, String action, String description, String ipAddress) {
            return new AuditLogCommand(accountId, action, description, ipAddress, null, AuditSeverity.INFO, null);
        }

        public static AuditLogCommand warning(Long accountId, String action, String description, String ipAddress) {
            return new AuditLogCommand(accountId, action, description, ipAddress, null, AuditSeverity.WARNING, null);
        }
    }

    public record AuditQuery(Long accountId, String action, AuditSeverity severity) {

        public static AuditQuery unfiltered() {
            return new AuditQuery(null, null, null);
        }
    }

    public record AuditLogEvent(AuditLogCommand command, OffsetDateTime occurredAt) {
    }
}
