package com.botflow.botflow_backend.model.domain;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

@Entity
@Table(name = "flow_edges", indexes = {
        @Index(name = "idx_flow_edges_bot", columnList = "bot_id"),
        @Index(name = "idx_flow_edges_bot_frontend", columnList = "bot_id, frontend_id"),
        @Index(name = "idx_flow_edges_bot_source_target", columnList = "bot_id, source_node_id, target_node_id")
})
@Data
public class FlowEdge {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "bot_id", nullable = false)
    private Long botId;

    @Column(name = "frontend_id")
    private String frontendId;

    @Column(name = "source_node_id", nullable = false)
    private Long sourceNodeId;

    @Column(name = "target_node_id", nullable = false)
    private Long targetNodeId;

    // Matched against user input during traversal; falls back to label when blank
    @Column(name = "condition_text", columnDefinition = "text")
    private String condition;

    private String label;

    @Column(name = "edge_type", length = 50)
    private String edgeType = "default";

    @Column(name = "source_handle")
    private String sourceHandle;

    @Column(name = "target_handle")
    private String targetHandle;

    @Column(nullable = false)
    private boolean animated = true;

    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> style;

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

    public String externalId() {
        return frontendId != null && !frontendId.isBlank() ? frontendId : String.valueOf(id);
    }
}
