package com.botflow.botflow_backend.model.domain;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

/**
 * One conversation step of a bot. Rows are soft-deleted so that conversation pointers
 * referencing them stay resolvable.
 */
@Entity
@Table(name = "flow_nodes", indexes = {
        @Index(name = "idx_flow_nodes_bot_frontend", columnList = "bot_id, frontend_id"),
        @Index(name = "idx_flow_nodes_bot_position", columnList = "bot_id, position")
})
@Data
public class FlowNode {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "bot_id", nullable = false)
    private Long botId;

    // Stable editor id; survives every save
    @Column(name = "frontend_id", length = 100)
    private String frontendId;

    @Column(name = "node_type", nullable = false, length = 50)
    private String nodeType = NodeType.MESSAGE.wireName();

    // Trigger phrase the user is expected to type
    @Column(name = "user_message", columnDefinition = "text")
    private String userMessage = "";

    @Column(name = "bot_response", columnDefinition = "text")
    private String botResponse = "";

    // Legacy contiguous ordering, only set by menu expansion at bot creation
    private Integer position;

    @Column(name = "position_x")
    private Double positionX;

    @Column(name = "position_y")
    private Double positionY;

    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> metadata;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted = false;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at")
    private Instant updatedAt = Instant.now();

    @PreUpdate
    public void onUpdate() {
        updatedAt = Instant.now();
    }

    /** The id the editor sees: the frontend id, or the storage id for rows that never had one. */
    public String externalId() {
        return frontendId != null && !frontendId.isBlank() ? frontendId : String.valueOf(id);
    }
}
