package com.sentinel.backend.modules.audit.application;

import java.util.HashMap;

import com.sentinel.backend.modules.account.domain.Account;
import com.sentinel.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.sentinel.backend.modules.audit.application.AuditLogService.AuditLogEvent;
import com.sentinel.backend.modules.audit.domain.AuditEntry;
import com.sentinel.backend.modules.audit.infrastructure.persistence.AuditEntryRepository;

import jakarta.persistence.EntityManager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Persists audit entries in their own transaction once the publishing transaction has committed,
 * or immediately when no transaction is active.
 */
@Component
public class AuditLogWriter {

    private static final Logger log = LoggerFactory.getLogger(AuditLogWriter.class);

    private static final int MAX_USER_AGENT_LENGTH = 500;

    private final AuditEntryRepository auditEntryRepository;
    private final EntityManager entityManager;
    private final TransactionTemplate transactionTemplate;

    public AuditLogWriter(
            AuditEntryRepository auditEntryRepository,
            EntityManager entityManager,
            PlatformTransactionManager transactionManager
    ) {
        this.auditEntryRepository = auditEntryRepository;
        this.entityManager = entityManager;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onAuditEvent(AuditLogEvent event) {
        AuditLogCommand command = event.command();
        try {
            transactionTemplate.executeWithoutResult(status -> auditEntryRepository.save(toEntry(event)));
        } catch (RuntimeException ex) {
            log.error("Failed to write audit entry action={} account={}", command.action(), command.accountId(), ex);
        }
    }

    private AuditEntry toEntry(AuditLogEvent event) {
        AuditLogCommand command = event.command();
        AuditEntry entry = new AuditEntry();
        if (command.accountId() != null) {
            entry.setActor(entityManager.getReference(Account.class, command.accountId()));
        }
        entry.setAction(command.action());
        entry.setDescription(command.description());
        entry.setIpAddress(command.ipAddress());
        entry.setUserAgent(truncate(command.userAgent()));
        entry.setSeverity(command.severity());
        if (command.payload() != null && !command.payload().isEmpty()) {
            entry.setPayload(new HashMap<>(command.payload()));
        }
        entry.setOccurredAt(event.occurredAt());
        return entry;
    }

    private static String truncate(String userAgent) {
        if (userAgent == null || userAgent.length() <= MAX_USER_AGENT_LENGTH) {
            return userAgent;
        }
        return userAgent.substring(0, MAX_USER_AGENT_LENGTH);
    }
}
