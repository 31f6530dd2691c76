package com.sentinel.backend.modules.device.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;

import com.sentinel.backend.modules.device.domain.Device;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface DeviceRepository extends JpaRepository<Device, Long> {

    Optional<Device> findFirstByMacAddressOrderByIdAsc(String macAddress);

    Optional<Device> findFirstByHostnameOrderByIdAsc(String hostname);

    @Query("""
            select d
              from Device d
              left join d.account a
             where (:accountId is null or a.id = :accountId)
               and (:active is null or d.active = :active)
             order by d.lastHeartbeatAt desc nulls last, d.id desc
            """)
    Page<Device> search(
            @Param("accountId") Long accountId,
            @Param("active") Boolean active,
            Pageable pageable
    );

    long countByLastHeartbeatAtAfter(OffsetDateTime threshold);
}
