package com.example.agentdeployer.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One provisioning of an agent into a client's n8n instance, with the latest
 * progress of the deployment attempt and a rolling health snapshot.
 */
@Entity
@Table(name = "deployments", indexes = {
        @Index(name = "idx_deployment_client_agent", columnList = "client_id, agent_id"),
        @Index(name = "idx_deployment_status", columnList = "status"),
        @Index(name = "idx_deployment_deployed_at", columnList = "deployed_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Deployment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "client_id", nullable = false)
    private String clientId;

    @Column(name = "agent_id", nullable = false)
    private String agentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "deployment_type", nullable = false)
    private DeploymentType deploymentType;

    @Column(name = "n8n_instance_url")
    private String n8nInstanceUrl;

    @ToString.Exclude
    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
    @Column(name = "n8n_api_key", length = 1024)
    private String n8nApiKey;

    @Column(name = "workflow_id")
    private String workflowId;

    @Column(name = "workflow_name", nullable = false)
    private String workflowName;

    @Column(name = "workflow_url", length = 1024)
    private String workflowUrl;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "deployment_credentials", joinColumns = @JoinColumn(name = "deployment_id"))
    @OrderColumn(name = "list_index")
    @Column(name = "n8n_credential_id")
    @Builder.Default
    private List<String> credentialIds = new ArrayList<>();

    /** Credential types still waiting for the OAuth consent step in n8n. */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "deployment_oauth_pending", joinColumns = @JoinColumn(name = "deployment_id"))
    @OrderColumn(name = "list_index")
    @Column(name = "credential_type")
    @Builder.Default
    private List<String> oauthPendingTypes = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private DeploymentStatus status = DeploymentStatus.DEPLOYING;

    @Column(name = "deployment_error", length = 4096)
    private String deploymentError;

    @Column(name = "error_type")
    private String errorType;

    @Builder.Default
    private boolean demo = false;

    // Latest progress event
    @Column(name = "progress_stage")
    private String progressStage;

    @Column(name = "progress_percent")
    private Integer progressPercent;

    @Column(name = "progress_message", length = 1024)
    private String progressMessage;

    // Health snapshot
    @Column(name = "last_health_check_at")
    private Instant lastHealthCheckAt;

    @Builder.Default
    private boolean healthy = true;

    @Column(name = "error_count")
    @Builder.Default
    private int errorCount = 0;

    @Column(name = "consecutive_errors")
    @Builder.Default
    private int consecutiveErrors = 0;

    /** Most recent health check failures, oldest first. */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "deployment_health_errors", joinColumns = @JoinColumn(name = "deployment_id"))
    @OrderColumn(name = "list_index")
    @Builder.Default
    private List<HealthError> recentErrors = new ArrayList<>();

    @Column(name = "last_execution_at")
    private Instant lastExecutionAt;

    @Column(name = "last_execution_status")
    private String lastExecutionStatus;

    @Column(name = "deployed_at", nullable = false, updatable = false)
    private Instant deployedAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "archived_at")
    private Instant archivedAt;

    @PrePersist
    protected void onCreate() {
        if (deployedAt == null) deployedAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public enum DeploymentStatus {
        DEPLOYING, DEPLOYED, FAILED, PAUSED, ARCHIVED
    }
}
