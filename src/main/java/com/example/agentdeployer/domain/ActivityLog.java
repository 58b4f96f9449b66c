package com.example.agentdeployer.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Append-only record of what happened to agents, clients and deployments.
 */
@Entity
@Table(name = "activity_log", indexes = {
        @Index(name = "idx_activity_entity", columnList = "entity_type, entity_id"),
        @Index(name = "idx_activity_action", columnList = "action"),
        @Index(name = "idx_activity_timestamp", columnList = "occurred_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivityLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    /** agent, client or deployment */
    @Column(name = "entity_type", nullable = false)
    private String entityType;

    @Column(name = "entity_id", nullable = false)
    private String entityId;

    /** created, deploying, deployed, failed, paused, resumed, ... */
    @Column(nullable = false)
    private String action;

    @Column(nullable = false, length = 2048)
    private String description;

    @Column(length = 4096)
    private String metadata;

    @Column(name = "occurred_at", nullable = false)
    private Instant timestamp;

    @PrePersist
    protected void onCreate() {
        if (timestamp == null) timestamp = Instant.now();
    }
}
