package com.sentinel.backend.modules.session.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;

import com.sentinel.backend.modules.session.domain.ClientSession;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ClientSessionRepository extends JpaRepository<ClientSession, Long> {

    Optional<ClientSession> findByTokenHash(String tokenHash);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from ClientSession s where s.tokenHash = :tokenHash and s.active = true")
    Optional<ClientSession> findActiveByTokenHashForUpdate(@Param("tokenHash") String tokenHash);

    @Modifying
    @Query("""
            update ClientSession s
               set s.active = false,
                   s.revokedAt = :revokedAt,
                   s.revokedReason = :reason
             where s.account.id = :accountId
               and s.active = true
            """)
    int revokeAllForAccount(@Param("accountId") Long accountId,
                            @Param("revokedAt") OffsetDateTime revokedAt,
                            @Param("reason") String reason);

    long countByActiveTrue();
}
