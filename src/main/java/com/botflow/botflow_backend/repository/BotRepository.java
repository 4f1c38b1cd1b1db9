package com.botflow.botflow_backend.repository;

import com.botflow.botflow_backend.model.domain.Bot;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface BotRepository extends JpaRepository<Bot, Long> {

    // Serialises graph writers (sync, restore, backup eviction) for one bot across processes
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select b from Bot b where b.id = :id")
    Optional<Bot> findByIdForUpdate(@Param("id") Long id);

    @Modifying
    @Query("update Bot b set b.messageCount = b.messageCount + 1 where b.id = :id")
    int incrementMessageCount(@Param("id") Long id);

    @Modifying
    @Query("update Bot b set b.conversationCount = b.conversationCount + 1 where b.id = :id")
    int incrementConversationCount(@Param("id") Long id);
}
