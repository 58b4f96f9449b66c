package com.example.agentdeployer.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A persisted health alert. The id is the alert id computed by the health
 * monitor, so recording the same alert twice is a no-op.
 */
@Entity
@Table(name = "deployment_alerts", indexes = {
        @Index(name = "idx_alert_deployment", columnList = "deployment_id"),
        @Index(name = "idx_alert_acknowledged", columnList = "acknowledged")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeploymentAlert {

    @Id
    private String id;

    @Column(name = "deployment_id", nullable = false)
    private String deploymentId;

    @Column(name = "client_id")
    private String clientId;

    @Column(name = "agent_id")
    private String agentId;

    @Column(nullable = false)
    private String severity;

    @Column(nullable = false)
    private String type;

    @Column(nullable = false, length = 1024)
    private String message;

    @Column(name = "raised_at", nullable = false)
    private Instant timestamp;

    @Builder.Default
    private boolean acknowledged = false;

    @Column(name = "acknowledged_at")
    private Instant acknowledgedAt;
}
