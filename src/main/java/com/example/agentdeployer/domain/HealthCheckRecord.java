package com.example.agentdeployer.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Historical health check of a deployment.
 */
@Entity
@Table(name = "health_checks", indexes = {
        @Index(name = "idx_health_deployment", columnList = "deployment_id"),
        @Index(name = "idx_health_timestamp", columnList = "checked_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthCheckRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "deployment_id", nullable = false)
    private String deploymentId;

    @Column(name = "checked_at", nullable = false)
    private Instant timestamp;

    @Enumerated(EnumType.STRING)
    @Column(name = "overall_status", nullable = false)
    private OverallStatus overallStatus;

    private boolean healthy;

    @Column(name = "workflow_active")
    private Boolean workflowActive;

    @Column(name = "recent_executions")
    private Integer recentExecutions;

    @Column(name = "success_rate")
    private Integer successRate;

    @Column(name = "avg_execution_time_ms")
    private Long avgExecutionTimeMs;

    @Column(name = "latency_ms")
    private Long latencyMs;

    @Column(name = "last_execution_id")
    private String lastExecutionId;

    @Column(name = "last_execution_status")
    private String lastExecutionStatus;

    @Column(name = "last_execution_at")
    private Instant lastExecutionAt;

    @Column(length = 2048)
    private String error;

    public enum OverallStatus {
        HEALTHY, WARNING, ERROR, UNKNOWN
    }
}
