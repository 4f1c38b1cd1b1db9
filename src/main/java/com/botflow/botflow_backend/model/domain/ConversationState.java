package com.botflow.botflow_backend.model.domain;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/**
 * Where one contact currently stands in one bot's graph. Reloaded on every inbound message;
 * nothing about a conversation is kept in memory between requests.
 */
@Entity
@Table(name = "conversation_states", uniqueConstraints = {
        @UniqueConstraint(name = "uq_conversation_bot_contact", columnNames = {"bot_id", "contact_identifier"})
})
@Data
public class ConversationState {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "bot_id", nullable = false)
    private Long botId;

    @Column(name = "contact_identifier", nullable = false, length = 100)
    private String contactIdentifier;

    @Column(name = "current_node_id", nullable = false)
    private Long currentNodeId;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at")
    private Instant updatedAt = Instant.now();

    @PreUpdate
    public void onUpdate() {
        updatedAt = Instant.now();
    }
}
