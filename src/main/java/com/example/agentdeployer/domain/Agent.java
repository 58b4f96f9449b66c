package com.example.agentdeployer.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A reusable n8n workflow template together with the credential schema
 * extracted from it when the agent was created.
 */
@Entity
@Table(name = "agents", indexes = {
        @Index(name = "idx_agent_name", columnList = "name"),
        @Index(name = "idx_agent_active", columnList = "active")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Agent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    /** The n8n workflow JSON as uploaded. */
    @Column(name = "template_json", columnDefinition = "TEXT", nullable = false)
    private String templateJson;

    /** Serialized CredentialSchema. */
    @Column(name = "credential_schema", columnDefinition = "TEXT")
    private String credentialSchemaJson;

    @Builder.Default
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    /** Soft delete marker. */
    @Column(name = "deleted_at")
    private Instant deletedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
