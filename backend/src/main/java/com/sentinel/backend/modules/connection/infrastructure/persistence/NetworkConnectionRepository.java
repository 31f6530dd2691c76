package com.sentinel.backend.modules.connection.infrastructure.persistence;

import java.time.OffsetDateTime;

import com.sentinel.backend.modules.connection.domain.NetworkConnection;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface NetworkConnectionRepository extends JpaRepository<NetworkConnection, Long> {

    @Query("""
            select c
              from NetworkConnection c
              left join c.device d
              left join c.account a
             where (:deviceId is null or d.id = :deviceId)
               and (:accountId is null or a.id = :accountId)
               and c.recordedAt >= :from
               and c.recordedAt <= :to
             order by c.recordedAt desc, c.id desc
            """)
    Page<NetworkConnection> search(
            @Param("deviceId") Long deviceId,
            @Param("accountId") Long accountId,
            @Param("from") OffsetDateTime from,
            @Param("to") OffsetDateTime to,
            Pageable pageable
    );
}
