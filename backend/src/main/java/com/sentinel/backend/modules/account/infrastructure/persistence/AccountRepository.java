package com.sentinel.backend.modules.account.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;

import com.sentinel.backend.modules.account.domain.Account;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AccountRepository extends JpaRepository<Account, Long> {

    @Query("select a from Account a where lower(a.email) = lower(:email)")
    Optional<Account> findByEmailIgnoreCase(@Param("email") String email);

    @Query("select a from Account a where lower(a.email) = lower(:email) and a.active = true")
    Optional<Account> findActiveByEmailIgnoreCase(@Param("email") String email);

    @Query("select case when count(a) > 0 then true else false end from Account a where lower(a.email) = lower(:email)")
    boolean existsByEmailIgnoreCase(@Param("email") String email);

    @Modifying
    @Query("update Account a set a.lastAccessAt = :accessedAt where a.id = :accountId")
    int touchLastAccess(@Param("accountId") Long accountId, @Param("accessedAt") OffsetDateTime accessedAt);

    @Query("""
            select a
              from Account a
             where (:active is null or a.active = :active)
               and (
                     :searchPattern is null
                  or lower(a.name) like :searchPattern
                  or lower(a.email) like :searchPattern
                  or lower(coalesce(a.company, '')) like :searchPattern
                  or lower(coalesce(a.phone, '')) like :searchPattern
               )
             order by a.createdAt desc, a.id desc
            """)
    Page<Account> search(
            @Param("active") Boolean active,
            @Param("searchPattern") String searchPattern,
            Pageable pageable
    );

    long countByLastAccessAtAfter(OffsetDateTime threshold);
}
