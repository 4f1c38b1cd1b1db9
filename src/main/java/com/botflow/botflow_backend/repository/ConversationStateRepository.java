package com.botflow.botflow_backend.repository;

import com.botflow.botflow_backend.model.domain.ConversationState;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface ConversationStateRepository extends JpaRepository<ConversationState, Long> {
    Optional<ConversationState> findByBotIdAndContactIdentifier(Long botId, String contactIdentifier);
}
