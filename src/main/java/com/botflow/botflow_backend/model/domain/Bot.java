package com.botflow.botflow_backend.model.domain;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "bots")
@Data
public class Bot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    /** Owning user as issued by the auth collaborator. Null for bots created without an owner. */
    @Column(name = "owner_id")
    private UUID ownerId;

    @Column(name = "webchat_enabled", nullable = false)
    private boolean webchatEnabled = true;

    @Column(name = "message_count", nullable = false)
    private long messageCount = 0L;

    @Column(name = "conversation_count", nullable = false)
    private long conversationCount = 0L;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at")
    private Instant updatedAt = Instant.now();

    @PreUpdate
    public void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isOwnedBy(UUID userId) {
        return userId == null || ownerId == null || ownerId.equals(userId);
    }
}
