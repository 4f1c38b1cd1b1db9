package com.botflow.botflow_backend.model.domain;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "flow_backups", uniqueConstraints = {
        @UniqueConstraint(name = "uq_flow_backups_bot_version", columnNames = {"bot_id", "version"})
})
@Data
public class FlowBackup {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "bot_id", nullable = false)
    private Long botId;

    @Column(nullable = false)
    private Long version;

    // Editor-write shape ({nodes, edges, name}) so a restore can replay it through sync
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false)
    private Map<String, Object> snapshot;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();
}
