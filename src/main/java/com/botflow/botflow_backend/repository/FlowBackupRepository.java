package com.botflow.botflow_backend.repository;

import com.botflow.botflow_backend.model.domain.FlowBackup;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface FlowBackupRepository extends JpaRepository<FlowBackup, UUID> {
    // Newest version first, for the backup list endpoint
    List<FlowBackup> findByBotIdOrderByVersionDesc(Long botId);

    // Oldest first; eviction deletes from the front
    List<FlowBackup> findByBotIdOrderByCreatedAtAscVersionAsc(Long botId);

    Optional<FlowBackup> findTopByBotIdOrderByVersionDesc(Long botId);

    long countByBotId(Long botId);
}
