package com.sentinel.backend.modules.identity.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;

import com.sentinel.backend.modules.identity.domain.IpIdentity;

import jakarta.persistence.LockModeType;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface IpIdentityRepository extends JpaRepository<IpIdentity, Long> {

    Optional<IpIdentity> findByIpAddress(String ipAddress);

    boolean existsByUsername(String username);

    Page<IpIdentity> findAllByOrderByLastSeenAtDescIdDesc(Pageable pageable);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select i from IpIdentity i where i.ipAddress = :ipAddress")
    Optional<IpIdentity> findByIpAddressForUpdate(@Param("ipAddress") String ipAddress);

    /**
     * Inserts a fresh identity unless one already exists for the address, or the username is taken.
     * Returns the number of rows inserted. A concurrent uncommitted insert for the same address makes
     * this statement wait for that transaction.
     */
    @Modifying
    @Query(value = """
            insert into ip_identity (ip_address, username, first_seen_at, last_seen_at, total_visits, metadata,
                                     created_at, updated_at)
            values (:ipAddress, :username, :now, :now, 0, cast('{}' as jsonb), :now, :now)
            on conflict do nothing
            """, nativeQuery = true)
    int insertIfAbsent(@Param("ipAddress") String ipAddress,
                       @Param("username") String username,
                       @Param("now") OffsetDateTime now);
}
