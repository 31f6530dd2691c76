package com.sentinel.backend.modules.chat.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;

import com.sentinel.backend.modules.chat.domain.ChatMessage;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ChatMessageRepository extends JpaRepository<ChatMessage, Long> {

    @Query("""
            select m
              from ChatMessage m
             where m.room = :room
               and m.deleted = false
               and m.sentAt < :before
             order by m.sentAt desc, m.id desc
            """)
    List<ChatMessage> findLatest(
            @Param("room") String room,
            @Param("before") OffsetDateTime before,
            Pageable pageable
    );

    long countBySentAtGreaterThanEqual(OffsetDateTime since);
}
