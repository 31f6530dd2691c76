package com.sentinel.backend.modules.audit.infrastructure.persistence;

import java.util.List;

import com.sentinel.backend.modules.audit.domain.AuditEntry;
import com.sentinel.backend.modules.audit.domain.AuditSeverity;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AuditEntryRepository extends JpaRepository<AuditEntry, Long> {

    @Query("""
            select e
              from AuditEntry e
              left join e.actor actor
             where (:accountId is null or actor.id = :accountId)
               and (:action is null or e.action = :action)
               and (:severity is null or e.severity = :severity)
             order by e.occurredAt desc, e.id desc
            """)
    List<AuditEntry> search(
            @Param("accountId") Long accountId,
            @Param("action") String action,
            @Param("severity") AuditSeverity severity,
            Pageable pageable
    );
}
