package com.example.agentdeployer.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * A tenant that receives agent deployments.
 */
@Entity
@Table(name = "clients", indexes = {
        @Index(name = "idx_client_email", columnList = "email"),
        @Index(name = "idx_client_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Client {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private String email;

    private String company;

    @Enumerated(EnumType.STRING)
    @Column(name = "deployment_type", nullable = false)
    private DeploymentType deploymentType;

    /** Only used for CLIENT_INSTANCE clients. */
    @Column(name = "n8n_instance_url")
    private String n8nInstanceUrl;

    @ToString.Exclude
    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
    @Column(name = "n8n_api_key", length = 1024)
    private String n8nApiKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private ClientStatus status = ClientStatus.ACTIVE;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public enum ClientStatus {
        ACTIVE, INACTIVE, SUSPENDED
    }
}
